package tollgate.core.service.gateway;

import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.config.ForwardingConfig;
import tollgate.core.model.auth.TokenClaims;
import tollgate.core.model.gateway.BackendTimeoutException;
import tollgate.core.model.gateway.BackendUnreachableException;
import tollgate.core.model.gateway.GatewayRequest;
import tollgate.core.model.gateway.GatewayResult;
import tollgate.core.model.routing.RouteMatch;
import tollgate.core.port.out.ProxyClient;

/**
 * Forwards a routed request to its backend and converts the outcome to a
 * {@link GatewayResult}.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>Timeout: 504, never retried</li>
 *   <li>Connection failure before anything was sent: retried once after a short backoff, then 502</li>
 *   <li>Any other transport failure: 502</li>
 *   <li>Backend error status: relayed as a normal response</li>
 * </ul>
 */
@ApplicationScoped
public class ProxyForwarder {

    private static final Logger LOG = Logger.getLogger(ProxyForwarder.class);

    private final ProxyClient proxyClient;
    private final ProxyRequestPreparer requestPreparer;
    private final ForwardingConfig config;

    @Inject
    public ProxyForwarder(ProxyClient proxyClient, ProxyRequestPreparer requestPreparer, ForwardingConfig config) {
        this.proxyClient = proxyClient;
        this.requestPreparer = requestPreparer;
        this.config = config;
    }

    /**
     * Forward the request to the backend of the resolved route.
     *
     * @param request the gateway request
     * @param match the resolved route
     * @param claims verified token claims, if any
     * @return the relayed response or a backend failure result
     */
    public Uni<GatewayResult> forward(GatewayRequest request, RouteMatch match, Optional<TokenClaims> claims) {
        final var prepared = requestPreparer.prepare(request, match, claims);
        final var timeout = match.route().timeout().orElse(config.defaultTimeout());
        final var backoff = positive(config.connectRetryBackoff());

        return proxyClient
                .forward(prepared, timeout)
                .onFailure(ProxyForwarder::isRetryable)
                .invoke(e -> LOG.debugv(
                        "Connection to {0} failed, retrying once: {1}", prepared.targetUri(), e.getMessage()))
                .onFailure(ProxyForwarder::isRetryable)
                .retry()
                .withBackOff(backoff, backoff)
                .atMost(1)
                .map(response -> (GatewayResult) new GatewayResult.Success(
                        response.statusCode(), requestPreparer.filterResponseHeaders(response.headers()), response.body()))
                .onFailure(BackendTimeoutException.class)
                .recoverWithItem(e -> {
                    final var timeoutException = (BackendTimeoutException) e;
                    LOG.warnv(
                            "Backend timeout: request={0} target={1} timeout={2}ms",
                            request.requestId(),
                            timeoutException.getTarget(),
                            timeoutException.getTimeout().toMillis());
                    return new GatewayResult.BackendTimeout(timeoutException.getTarget(), timeoutException.getTimeout());
                })
                .onFailure(BackendUnreachableException.class)
                .recoverWithItem(e -> {
                    final var unreachable = (BackendUnreachableException) e;
                    LOG.warnv(
                            "Backend unreachable: request={0} target={1} cause={2}",
                            request.requestId(),
                            unreachable.getTarget(),
                            describe(unreachable.getCause()));
                    return new GatewayResult.BackendUnreachable(unreachable.getTarget(), describe(unreachable.getCause()));
                });
    }

    private static boolean isRetryable(Throwable failure) {
        return failure instanceof BackendUnreachableException unreachable && unreachable.isRetryable();
    }

    private static Duration positive(Duration duration) {
        return duration == null || duration.isZero() || duration.isNegative() ? Duration.ofMillis(1) : duration;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
    }
}
