package tollgate.core.port.out;

import java.time.Duration;

import tollgate.core.model.gateway.RequestOutcome;

/**
 * Port interface for recording gateway metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a completed request.
     *
     * @param route the matched route prefix, or {@code none}
     * @param method the HTTP method
     * @param outcome the request outcome
     * @param statusCode the status reported to the client
     */
    void recordRequest(String route, String method, RequestOutcome outcome, int statusCode);

    /**
     * Record end-to-end request latency.
     *
     * @param route the matched route prefix, or {@code none}
     * @param method the HTTP method
     * @param outcome the request outcome
     * @param latency time from receipt to completion
     */
    void recordLatency(String route, String method, RequestOutcome outcome, Duration latency);

    /**
     * Record traffic volume.
     *
     * @param route the matched route prefix, or {@code none}
     * @param requestBytes incoming bytes
     * @param responseBytes outgoing bytes
     */
    void recordTraffic(String route, long requestBytes, long responseBytes);

    /**
     * Record an authentication failure.
     *
     * @param reason the failure reason code
     */
    void recordAuthFailure(String reason);

    /**
     * Record a rate limit rejection.
     *
     * @param identityKind {@code subject} or {@code address}
     */
    void recordRateLimitExceeded(String identityKind);

    /**
     * Record an observability record that was dropped.
     */
    void recordObservabilityDropped();
}
