package tollgate.core.model.ratelimit;

import java.time.Instant;

/**
 * Handler interface for rate limiting algorithm implementations.
 *
 * <p>Each algorithm (sliding window, fixed window) implements this interface to
 * provide its specific rate limiting logic.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li>Thread-safe</li>
 *   <li>Stateless (state is passed in and returned)</li>
 *   <li>Deterministic given the same inputs</li>
 * </ul>
 */
public interface RateLimitAlgorithmHandler {

    /**
     * Returns the algorithm type this handler implements.
     *
     * @return the algorithm type
     */
    RateLimitAlgorithm algorithm();

    /**
     * Check if a request is allowed and compute the new state.
     *
     * @param currentState the current rate limit state (may be null for first request)
     * @param limit the effective rate limit configuration
     * @param nowMillis the current timestamp in milliseconds
     * @return the decision including the new state
     */
    RateLimitDecision checkAndConsume(RateLimitState currentState, EffectiveRateLimit limit, long nowMillis);

    /**
     * Create the initial state for a client seen for the first time.
     *
     * @param limit the effective rate limit configuration
     * @param nowMillis the current timestamp in milliseconds
     * @return the initial state
     */
    RateLimitState createInitialState(EffectiveRateLimit limit, long nowMillis);

    /**
     * Get the current status without consuming capacity.
     *
     * @param currentState the current rate limit state (may be null)
     * @param limit the effective rate limit configuration
     * @param nowMillis the current timestamp in milliseconds
     * @return the current status
     */
    default RateLimitDecision getStatus(RateLimitState currentState, EffectiveRateLimit limit, long nowMillis) {
        if (currentState == null) {
            final var initialState = createInitialState(limit, nowMillis);
            return createAllowedDecision(initialState, limit, nowMillis);
        }
        return computeStatus(currentState, limit, nowMillis);
    }

    /**
     * Compute the status for existing state without consuming.
     *
     * @param currentState the current state (not null)
     * @param limit the rate limit configuration
     * @param nowMillis current timestamp
     * @return the status decision
     */
    RateLimitDecision computeStatus(RateLimitState currentState, EffectiveRateLimit limit, long nowMillis);

    /**
     * Create an allowed decision with the given state.
     *
     * @param state the current state
     * @param limit the rate limit configuration
     * @param nowMillis current timestamp
     * @return an allowed decision
     */
    default RateLimitDecision createAllowedDecision(RateLimitState state, EffectiveRateLimit limit, long nowMillis) {
        final var count = state.requestCount();
        return RateLimitDecision.allow(
                limit.requestsPerWindow() - count,
                limit.requestsPerWindow(),
                limit.windowSeconds(),
                computeResetTime(state, limit, nowMillis),
                count,
                state);
    }

    /**
     * Compute when the window measured from the state's timestamp ends.
     *
     * @param state the current state
     * @param limit the rate limit configuration
     * @param nowMillis current timestamp
     * @return reset time as Instant
     */
    default Instant computeResetTime(RateLimitState state, EffectiveRateLimit limit, long nowMillis) {
        if (state.requestCount() == 0) {
            return Instant.ofEpochMilli(nowMillis + limit.windowMillis());
        }
        return Instant.ofEpochMilli(state.timestampMillis() + limit.windowMillis());
    }
}
