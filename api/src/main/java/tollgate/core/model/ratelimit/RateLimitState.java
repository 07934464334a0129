package tollgate.core.model.ratelimit;

/**
 * Algorithm-agnostic interface for per-client rate limit state.
 *
 * <p>Different rate limiting algorithms maintain different state:
 * <ul>
 *   <li>Sliding window: timestamps of admitted requests in the trailing window</li>
 *   <li>Fixed window: request count and window start timestamp</li>
 * </ul>
 *
 * <p>Implementations must be immutable and safe for concurrent access.
 *
 * @see SlidingWindowState
 * @see FixedWindowState
 */
public sealed interface RateLimitState permits SlidingWindowState, FixedWindowState {

    /**
     * Returns the number of requests counted in the current window.
     *
     * @return counted requests
     */
    int requestCount();

    /**
     * Returns the timestamp (epoch millis) the current window is measured from.
     *
     * <p>For the sliding window this is the oldest counted request.
     * For the fixed window this is the window start.
     *
     * @return timestamp in epoch milliseconds
     */
    long timestampMillis();
}
