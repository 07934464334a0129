package tollgate.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for forwarding requests to backends.
 *
 * <p>Configuration prefix: {@code tollgate.forwarding}
 */
@ConfigMapping(prefix = "tollgate.forwarding")
public interface ForwardingConfig {

    /**
     * Timeout for routes without their own timeout.
     *
     * <p>If exceeded, returns 504 Gateway Timeout.
     *
     * @return request timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration defaultTimeout();

    /**
     * Maximum time to establish a TCP connection to a backend.
     *
     * @return connect timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration connectTimeout();

    /**
     * Delay before the single retry of a request whose connection failed.
     *
     * @return backoff (default: 100 milliseconds)
     */
    @WithDefault("PT0.1S")
    Duration connectRetryBackoff();

    /**
     * Forward the client's Authorization header to the backend.
     *
     * @return true to forward it (default: false)
     */
    @WithDefault("false")
    boolean forwardAuthorization();

    /**
     * Add X-Authenticated-Subject and X-Authenticated-Scopes headers derived
     * from the validated token.
     *
     * @return true to add identity headers (default: false)
     */
    @WithDefault("false")
    boolean identityHeaders();

    /**
     * Take the client address from Forwarded, X-Forwarded-For or X-Real-IP.
     *
     * <p>Enable only behind a trusted load balancer that overwrites these headers.
     *
     * @return true to trust forwarding headers (default: false)
     */
    @WithDefault("false")
    boolean trustForwardedHeaders();

    /**
     * Value used in the Via header.
     *
     * @return the pseudonym (default: tollgate)
     */
    @WithDefault("tollgate")
    String viaPseudonym();
}
