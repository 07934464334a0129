package tollgate.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.gateway.PreparedProxyRequest;
import tollgate.core.model.gateway.ProxyResponse;

/**
 * Port interface for sending one request to a backend.
 *
 * <p>The returned {@link Uni} fails with
 * {@link tollgate.core.model.gateway.BackendTimeoutException} when no response
 * arrives within {@code timeout}, and with
 * {@link tollgate.core.model.gateway.BackendUnreachableException} on transport
 * failures. HTTP error statuses are normal responses. Cancelling the subscription
 * aborts the backend request.
 */
public interface ProxyClient {

    Uni<ProxyResponse> forward(PreparedProxyRequest request, Duration timeout);
}
