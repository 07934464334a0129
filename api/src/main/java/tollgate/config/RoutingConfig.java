package tollgate.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the static route table.
 *
 * <p>Configuration prefix: {@code tollgate.routing}
 *
 * <p>Example:
 * <pre>{@code
 * tollgate.routing.routes[0].prefix=/users
 * tollgate.routing.routes[0].url=http://users.internal:8080
 * tollgate.routing.routes[0].timeout=PT5S
 * tollgate.routing.routes[1].prefix=/
 * tollgate.routing.routes[1].url=http://localhost:9000
 * }</pre>
 *
 * <p>Order matters: among routes with equally long prefixes the first one wins.
 */
@ConfigMapping(prefix = "tollgate.routing")
public interface RoutingConfig {

    /**
     * Configured routes, in priority order for equal-length prefixes.
     *
     * @return the routes
     */
    Optional<List<Route>> routes();

    /**
     * A single route.
     */
    interface Route {

        /**
         * Public path prefix, e.g. {@code /users}.
         */
        String prefix();

        /**
         * Backend base URL, e.g. {@code http://users.internal:8080}.
         */
        String url();

        /**
         * Per-route timeout; falls back to {@code tollgate.forwarding.default-timeout}.
         */
        Optional<Duration> timeout();

        /**
         * Remove the prefix from the forwarded path.
         */
        @WithDefault("false")
        boolean stripPrefix();
    }
}
