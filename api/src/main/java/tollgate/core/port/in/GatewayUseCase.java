package tollgate.core.port.in;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.gateway.GatewayRequest;
import tollgate.core.model.gateway.GatewayResult;

/**
 * Use case for running a request through the gateway.
 *
 * <p>The request is authenticated, rate limited, routed and forwarded in that
 * order; the first failing step decides the result.
 */
public interface GatewayUseCase {

    /**
     * Forward a request through the gateway.
     *
     * <p>The returned {@link Uni} never fails: every failure is expressed as a
     * {@link GatewayResult}. Cancelling it aborts any in-flight backend call.
     *
     * @param request the gateway request containing path, method, headers, and body
     * @return the gateway result
     */
    Uni<GatewayResult> forward(GatewayRequest request);
}
