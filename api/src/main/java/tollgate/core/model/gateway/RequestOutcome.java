package tollgate.core.model.gateway;

/**
 * Terminal outcome of one request through the gateway.
 */
public enum RequestOutcome {
    FORWARDED(0),
    UNAUTHORIZED(401),
    RATE_LIMITED(429),
    ROUTE_NOT_FOUND(404),
    BACKEND_TIMEOUT(504),
    BACKEND_UNREACHABLE(502),
    // Not sent; the client is gone. 499 follows the common proxy convention for logs and metrics.
    CLIENT_DISCONNECTED(499),
    INTERNAL_ERROR(500);

    private final int defaultStatus;

    RequestOutcome(int defaultStatus) {
        this.defaultStatus = defaultStatus;
    }

    /**
     * Returns the status reported for this outcome. Forwarded requests report the
     * backend's status instead.
     *
     * @return the HTTP status code, or 0 for {@link #FORWARDED}
     */
    public int defaultStatus() {
        return defaultStatus;
    }

    /**
     * Whether the request was rejected by a security stage.
     *
     * @return true for authentication and rate limit rejections
     */
    public boolean isSecurityRejection() {
        return this == UNAUTHORIZED || this == RATE_LIMITED;
    }
}
