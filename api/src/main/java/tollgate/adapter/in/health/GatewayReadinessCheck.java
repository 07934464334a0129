package tollgate.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import tollgate.core.port.out.RateLimiter;
import tollgate.core.port.out.TokenValidator;
import tollgate.core.service.routing.RouteTable;

/**
 * Readiness check for the gateway configuration.
 *
 * <p>Reports DOWN when no routes are configured or no token verification key is
 * loaded, since every request would then be rejected. Backends are not probed.
 */
@Readiness
@ApplicationScoped
public class GatewayReadinessCheck implements HealthCheck {

    private final RouteTable routeTable;
    private final TokenValidator tokenValidator;
    private final RateLimiter rateLimiter;

    @Inject
    public GatewayReadinessCheck(RouteTable routeTable, TokenValidator tokenValidator, RateLimiter rateLimiter) {
        this.routeTable = routeTable;
        this.tokenValidator = tokenValidator;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public HealthCheckResponse call() {
        final var routesLoaded = !routeTable.isEmpty();
        final var keyLoaded = tokenValidator.isReady();

        return HealthCheckResponse.builder()
                .name("gateway")
                .withData("routes", routeTable.routes().size())
                .withData("token.key.loaded", keyLoaded)
                .withData("ratelimit.enabled", rateLimiter.isEnabled())
                .status(routesLoaded && keyLoaded)
                .build();
    }
}
