package tollgate.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for gateway errors.
 *
 * <p>Details never carry internal exception text; the operator-facing reason is
 * logged with the request record instead.
 */
public final class GatewayProblem {

    private GatewayProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Authentication Errors ==========

    /**
     * Create a 401 problem with a bearer challenge.
     *
     * @param detail client-safe failure description
     * @return unauthorized problem
     */
    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withHeader("WWW-Authenticate", "Bearer")
                .withDetail(detail)
                .build();
    }

    // ========== Rate Limit Errors ==========

    /**
     * Create a 429 Too Many Requests problem with full rate limit details.
     *
     * @param retryAfterSeconds seconds until client can retry
     * @param limit the rate limit
     * @param resetAt Unix timestamp when limit resets
     * @param includeQuotaHeaders whether to add the {@code X-RateLimit-*} headers
     * @return rate limit problem
     */
    public static HttpProblem tooManyRequests(
            long retryAfterSeconds, long limit, long resetAt, boolean includeQuotaHeaders) {
        final var builder = HttpProblem.builder()
                .withTitle("Too Many Requests")
                .withStatus(Status.TOO_MANY_REQUESTS)
                .withHeader("Retry-After", retryAfterSeconds)
                .withDetail("Rate limit exceeded. Retry after %d seconds.".formatted(retryAfterSeconds))
                .with("retryAfter", retryAfterSeconds)
                .with("limit", limit)
                .with("remaining", 0)
                .with("resetAt", resetAt);

        if (includeQuotaHeaders) {
            builder.withHeader("X-RateLimit-Limit", limit)
                    .withHeader("X-RateLimit-Remaining", 0)
                    .withHeader("X-RateLimit-Reset", resetAt);
        }
        return builder.build();
    }

    // ========== Not Found Errors ==========

    public static HttpProblem routeNotFound(String path) {
        return HttpProblem.builder()
                .withTitle("Route Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("No route matches path '%s'".formatted(path))
                .build();
    }

    // ========== Gateway Errors ==========

    public static HttpProblem badGateway(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Gateway")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem gatewayTimeout(String detail) {
        return HttpProblem.builder()
                .withTitle("Gateway Timeout")
                .withStatus(Status.GATEWAY_TIMEOUT)
                .withDetail(detail)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
