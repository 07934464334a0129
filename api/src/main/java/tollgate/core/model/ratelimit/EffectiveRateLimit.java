package tollgate.core.model.ratelimit;

import java.time.Duration;

/**
 * The rate limit applied to a client: at most {@code requestsPerWindow} admitted
 * requests within any trailing window of length {@code window}.
 *
 * @param requestsPerWindow the maximum requests allowed per window
 * @param window the duration of the rate limit window
 */
public record EffectiveRateLimit(long requestsPerWindow, Duration window) {

    /**
     * Create an effective rate limit with validation.
     */
    public EffectiveRateLimit {
        if (requestsPerWindow < 0) {
            throw new IllegalArgumentException("requestsPerWindow must be non-negative");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    /**
     * Create an effective rate limit from a request count and a window in seconds.
     *
     * @param requestsPerWindow the maximum requests per window
     * @param windowSeconds the window duration in seconds
     * @return the rate limit
     */
    public static EffectiveRateLimit of(long requestsPerWindow, long windowSeconds) {
        return new EffectiveRateLimit(requestsPerWindow, Duration.ofSeconds(windowSeconds));
    }

    /**
     * Return the window length in milliseconds.
     *
     * @return window length in milliseconds
     */
    public long windowMillis() {
        return window.toMillis();
    }

    /**
     * Return the window length in whole seconds, rounded up.
     *
     * @return window length in seconds
     */
    public long windowSeconds() {
        return (window.toMillis() + 999) / 1000;
    }
}
