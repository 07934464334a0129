package tollgate.core.model.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of a rate limit check, indicating whether a request is allowed and
 * providing information about the current rate limit state.
 *
 * @param allowed whether the request is allowed
 * @param remaining number of requests remaining in the current window
 * @param limit the total limit for the window
 * @param windowSeconds the window duration in seconds
 * @param resetAt when the oldest counted request leaves the window
 * @param retryAfter time until the client can retry (zero when allowed)
 * @param requestCount requests counted in the current window after this decision
 * @param newState the updated rate limit state (for storage)
 */
public record RateLimitDecision(
        boolean allowed,
        long remaining,
        long limit,
        long windowSeconds,
        Instant resetAt,
        Duration retryAfter,
        int requestCount,
        RateLimitState newState) {

    /**
     * Create a decision with validation.
     */
    public RateLimitDecision {
        if (resetAt == null) {
            throw new IllegalArgumentException("resetAt must not be null");
        }
        retryAfter = retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
        remaining = Math.max(0, remaining);
    }

    /**
     * Create an "allowed" decision with default values.
     *
     * <p>Used when rate limiting is disabled.
     *
     * @return an allowed decision
     */
    public static RateLimitDecision allow() {
        return new RateLimitDecision(true, Long.MAX_VALUE, Long.MAX_VALUE, 0, Instant.MAX, Duration.ZERO, 0, null);
    }

    /**
     * Create an "allowed" decision with the specified state.
     *
     * @param remaining remaining requests in the window
     * @param limit the total limit
     * @param windowSeconds the window duration
     * @param resetAt when the window resets
     * @param requestCount requests counted in this window
     * @param newState the updated state
     * @return an allowed decision
     */
    public static RateLimitDecision allow(
            long remaining,
            long limit,
            long windowSeconds,
            Instant resetAt,
            int requestCount,
            RateLimitState newState) {
        return new RateLimitDecision(
                true, remaining, limit, windowSeconds, resetAt, Duration.ZERO, requestCount, newState);
    }

    /**
     * Create a "rejected" decision indicating rate limit exceeded.
     *
     * @param limit the total limit
     * @param windowSeconds the window duration
     * @param resetAt when the window resets
     * @param retryAfter time until a retry can be admitted
     * @param requestCount requests counted in this window
     * @param newState the current state
     * @return a rejected decision
     */
    public static RateLimitDecision rejected(
            long limit,
            long windowSeconds,
            Instant resetAt,
            Duration retryAfter,
            int requestCount,
            RateLimitState newState) {
        return new RateLimitDecision(false, 0, limit, windowSeconds, resetAt, retryAfter, requestCount, newState);
    }

    /**
     * Return the retry delay as whole seconds for the {@code Retry-After} header.
     *
     * <p>Rounded up, and never less than one second for a rejection.
     *
     * @return seconds until retry, or 0 when allowed
     */
    public long retryAfterSeconds() {
        if (allowed) {
            return 0;
        }
        final var millis = retryAfter.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }

    /**
     * Return the reset time as epoch seconds for response headers.
     *
     * @return reset time as epoch seconds
     */
    public long resetAtEpochSeconds() {
        return resetAt.getEpochSecond();
    }
}
