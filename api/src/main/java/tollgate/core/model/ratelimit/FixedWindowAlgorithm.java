package tollgate.core.model.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed window rate limiting algorithm.
 *
 * <p>A window opens with a client's first request and lasts for the configured
 * window length. Up to {@code requestsPerWindow} requests are admitted within it;
 * the counter starts over with the first request after the window has elapsed.
 */
public final class FixedWindowAlgorithm implements RateLimitAlgorithmHandler {

    private static final FixedWindowAlgorithm INSTANCE = new FixedWindowAlgorithm();

    private FixedWindowAlgorithm() {}

    /**
     * Returns the singleton instance.
     *
     * @return the fixed window algorithm instance
     */
    public static FixedWindowAlgorithm getInstance() {
        return INSTANCE;
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return RateLimitAlgorithm.FIXED_WINDOW;
    }

    @Override
    public RateLimitDecision checkAndConsume(RateLimitState currentState, EffectiveRateLimit limit, long nowMillis) {

        final var state = currentWindow(currentState, limit, nowMillis);

        if (state.count() < limit.requestsPerWindow()) {
            return createAllowedDecision(state.increment(), limit, nowMillis);
        }
        return createRejectedResult(state, limit, nowMillis);
    }

    @Override
    public RateLimitState createInitialState(EffectiveRateLimit limit, long nowMillis) {
        return new FixedWindowState(0, nowMillis);
    }

    @Override
    public RateLimitDecision computeStatus(RateLimitState currentState, EffectiveRateLimit limit, long nowMillis) {

        final var state = currentWindow(currentState, limit, nowMillis);
        if (state.count() < limit.requestsPerWindow()) {
            return createAllowedDecision(state, limit, nowMillis);
        }
        return createRejectedResult(state, limit, nowMillis);
    }

    @Override
    public Instant computeResetTime(RateLimitState state, EffectiveRateLimit limit, long nowMillis) {
        return Instant.ofEpochMilli(state.timestampMillis() + limit.windowMillis());
    }

    private FixedWindowState currentWindow(RateLimitState currentState, EffectiveRateLimit limit, long nowMillis) {

        if (currentState instanceof FixedWindowState fixed && !fixed.isExpired(limit.windowMillis(), nowMillis)) {
            return fixed;
        }
        return (FixedWindowState) createInitialState(limit, nowMillis);
    }

    private RateLimitDecision createRejectedResult(FixedWindowState state, EffectiveRateLimit limit, long nowMillis) {

        final var resetAt = computeResetTime(state, limit, nowMillis);
        final var retryAfter = Duration.ofMillis(Math.max(0, resetAt.toEpochMilli() - nowMillis));

        return RateLimitDecision.rejected(
                limit.requestsPerWindow(), limit.windowSeconds(), resetAt, retryAfter, state.count(), state);
    }
}
