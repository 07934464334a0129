package tollgate.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import tollgate.config.RateLimitingConfig;
import tollgate.core.port.out.TokenValidator;
import tollgate.core.service.routing.RouteTable;

/**
 * Logs the gateway version and effective configuration once at startup.
 *
 * <p>Resolving the route table and token validator here makes invalid routes or
 * keys fail the boot instead of the first request.
 */
@ApplicationScoped
public class GatewayStartup {

    private static final Logger LOG = Logger.getLogger(GatewayStartup.class);

    private final RouteTable routeTable;
    private final TokenValidator tokenValidator;
    private final RateLimitingConfig rateLimitingConfig;
    private final String version;

    @Inject
    public GatewayStartup(
            RouteTable routeTable,
            TokenValidator tokenValidator,
            RateLimitingConfig rateLimitingConfig,
            @ConfigProperty(name = "quarkus.application.version", defaultValue = "unknown") String version) {
        this.routeTable = routeTable;
        this.tokenValidator = tokenValidator;
        this.rateLimitingConfig = rateLimitingConfig;
        this.version = version;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.infov(
                "Tollgate {0} started: routes={1} tokenKeyLoaded={2} rateLimiting={3}",
                version,
                routeTable.routes().size(),
                tokenValidator.isReady(),
                describeRateLimiting());
    }

    private String describeRateLimiting() {
        if (!rateLimitingConfig.enabled()) {
            return "disabled";
        }
        return "%s %d/%ds".formatted(
                rateLimitingConfig.algorithm(),
                rateLimitingConfig.requestsPerWindow(),
                rateLimitingConfig.windowSeconds());
    }
}
