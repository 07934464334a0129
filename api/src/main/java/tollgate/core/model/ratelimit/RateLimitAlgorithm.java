package tollgate.core.model.ratelimit;

/**
 * Rate limiting algorithms supported by the gateway.
 *
 * <p>The algorithm is configured once for the whole gateway via
 * {@code tollgate.rate-limiting.algorithm}.
 */
public enum RateLimitAlgorithm {

    /**
     * Sliding window log (default).
     *
     * <p>Keeps the timestamp of every admitted request in the trailing window.
     * No client can exceed the limit within any window of the configured length,
     * including windows that straddle a boundary.
     */
    SLIDING_WINDOW,

    /**
     * Fixed window algorithm.
     *
     * <p>Counts requests within fixed time windows with a hard cutoff at
     * window boundaries. Simple and predictable, but can allow double the
     * limit across a boundary.
     */
    FIXED_WINDOW
}
