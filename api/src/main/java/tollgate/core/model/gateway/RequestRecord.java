package tollgate.core.model.gateway;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Observability record written once per completed request.
 *
 * @param requestId     correlation id
 * @param timestamp     when the request was received
 * @param clientId      the client identity key ({@code subject:...} or {@code address:...})
 * @param method        HTTP method
 * @param path          request path
 * @param routePrefix   the matched route prefix, if routing was reached
 * @param outcome       terminal outcome
 * @param statusCode    status reported to the client
 * @param latency       time from receipt to completion
 * @param requestBytes  request body size
 * @param responseBytes response body size
 * @param lastState     the furthest pipeline state reached
 * @param reason        operator-facing detail for rejections and failures
 */
public record RequestRecord(
        String requestId,
        Instant timestamp,
        String clientId,
        String method,
        String path,
        Optional<String> routePrefix,
        RequestOutcome outcome,
        int statusCode,
        Duration latency,
        long requestBytes,
        long responseBytes,
        PipelineState lastState,
        Optional<String> reason) {

    public RequestRecord {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        routePrefix = routePrefix == null ? Optional.empty() : routePrefix;
        reason = reason == null ? Optional.empty() : reason;
        latency = latency == null ? Duration.ZERO : latency;
    }

    /**
     * Returns the route tag used in metrics.
     *
     * @return the route prefix, or {@code none}
     */
    public String routeTag() {
        return routePrefix.orElse("none");
    }
}
