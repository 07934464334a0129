package tollgate.adapter.out.ratelimit;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.ratelimit.EffectiveRateLimit;
import tollgate.core.model.ratelimit.RateLimitDecision;
import tollgate.core.model.ratelimit.RateLimitKey;
import tollgate.core.port.out.RateLimiter;

/**
 * A no-op rate limiter that allows all requests.
 *
 * <p>Used when rate limiting is disabled.
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final NoOpRateLimiter INSTANCE = new NoOpRateLimiter();

    private NoOpRateLimiter() {}

    /**
     * Return the singleton instance.
     *
     * @return the no-op rate limiter
     */
    public static NoOpRateLimiter getInstance() {
        return INSTANCE;
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, EffectiveRateLimit limit) {
        return Uni.createFrom().item(RateLimitDecision.allow());
    }

    @Override
    public Uni<RateLimitDecision> getStatus(RateLimitKey key, EffectiveRateLimit limit) {
        return Uni.createFrom().item(RateLimitDecision.allow());
    }

    @Override
    public Uni<Void> reset(RateLimitKey key) {
        return Uni.createFrom().voidItem();
    }

    @Override
    public long activeKeyCount() {
        return 0;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
