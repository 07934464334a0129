package tollgate.core.model.ratelimit;

/**
 * Fixed window state for rate limiting.
 *
 * @param count the number of requests counted in the current window
 * @param windowStartMillis when the current window started (epoch millis)
 */
public record FixedWindowState(int count, long windowStartMillis) implements RateLimitState {

    /**
     * Creates a fixed window state with validation.
     */
    public FixedWindowState {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
        if (windowStartMillis < 0) {
            throw new IllegalArgumentException("windowStartMillis must be non-negative");
        }
    }

    /**
     * Returns a new state with one more counted request.
     *
     * @return the incremented state
     */
    public FixedWindowState increment() {
        return new FixedWindowState(count + 1, windowStartMillis);
    }

    /**
     * Whether the window starting at {@link #windowStartMillis()} has ended.
     *
     * @param windowMillis the window length
     * @param nowMillis the current time
     * @return true if the window has elapsed
     */
    public boolean isExpired(long windowMillis, long nowMillis) {
        return nowMillis - windowStartMillis >= windowMillis;
    }

    @Override
    public int requestCount() {
        return count;
    }

    @Override
    public long timestampMillis() {
        return windowStartMillis;
    }
}
