package tollgate.core.model.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Sliding window log rate limiting algorithm.
 *
 * <p>Each admitted request leaves its timestamp in the client's log. A request is
 * admitted when fewer than {@code requestsPerWindow} timestamps fall within the
 * trailing window {@code (now - window, now]}.
 *
 * <p>Key characteristics:
 * <ul>
 *   <li>No window of the configured length ever holds more than the limit</li>
 *   <li>No boundary bursts</li>
 *   <li>State grows with the limit, not with traffic</li>
 * </ul>
 *
 * <p>A rejected client may retry once its oldest counted request leaves the window.
 */
public final class SlidingWindowAlgorithm implements RateLimitAlgorithmHandler {

    private static final SlidingWindowAlgorithm INSTANCE = new SlidingWindowAlgorithm();

    private SlidingWindowAlgorithm() {}

    /**
     * Returns the singleton instance.
     *
     * @return the sliding window algorithm instance
     */
    public static SlidingWindowAlgorithm getInstance() {
        return INSTANCE;
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return RateLimitAlgorithm.SLIDING_WINDOW;
    }

    @Override
    public RateLimitDecision checkAndConsume(RateLimitState currentState, EffectiveRateLimit limit, long nowMillis) {

        final var state = resolveState(currentState, limit, nowMillis).prune(nowMillis - limit.windowMillis());

        if (state.requestCount() < limit.requestsPerWindow()) {
            return createAllowedDecision(state.append(nowMillis), limit, nowMillis);
        }
        return createRejectedResult(state, limit, nowMillis);
    }

    @Override
    public RateLimitState createInitialState(EffectiveRateLimit limit, long nowMillis) {
        return SlidingWindowState.empty();
    }

    @Override
    public RateLimitDecision computeStatus(RateLimitState currentState, EffectiveRateLimit limit, long nowMillis) {

        final var state = resolveState(currentState, limit, nowMillis).prune(nowMillis - limit.windowMillis());
        if (state.requestCount() < limit.requestsPerWindow()) {
            return createAllowedDecision(state, limit, nowMillis);
        }
        return createRejectedResult(state, limit, nowMillis);
    }

    private SlidingWindowState resolveState(RateLimitState currentState, EffectiveRateLimit limit, long nowMillis) {

        if (currentState instanceof SlidingWindowState sliding) {
            return sliding;
        }
        // State left behind by another algorithm is discarded
        return (SlidingWindowState) createInitialState(limit, nowMillis);
    }

    private RateLimitDecision createRejectedResult(SlidingWindowState state, EffectiveRateLimit limit, long nowMillis) {

        final Duration retryAfter;
        final Instant resetAt;
        if (state.requestCount() == 0) {
            // Only reachable with a zero limit
            retryAfter = limit.window();
            resetAt = Instant.ofEpochMilli(nowMillis + limit.windowMillis());
        } else {
            final var leavesWindowAt = state.oldestMillis() + limit.windowMillis();
            retryAfter = Duration.ofMillis(Math.max(0, leavesWindowAt - nowMillis));
            resetAt = Instant.ofEpochMilli(leavesWindowAt);
        }

        return RateLimitDecision.rejected(
                limit.requestsPerWindow(), limit.windowSeconds(), resetAt, retryAfter, state.requestCount(), state);
    }
}
