package tollgate.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.smallrye.mutiny.Uni;

import tollgate.core.model.ratelimit.AlgorithmRegistry;
import tollgate.core.model.ratelimit.EffectiveRateLimit;
import tollgate.core.model.ratelimit.RateLimitAlgorithm;
import tollgate.core.model.ratelimit.RateLimitAlgorithmHandler;
import tollgate.core.model.ratelimit.RateLimitDecision;
import tollgate.core.model.ratelimit.RateLimitKey;
import tollgate.core.model.ratelimit.RateLimitState;
import tollgate.core.port.out.RateLimiter;

/**
 * In-memory rate limiter implementation.
 *
 * <p>
 * Stores rate limit state in a Caffeine cache. Each decision runs inside the
 * cache map's atomic {@code compute} for its key, so concurrent requests from one
 * client are decided one at a time while different clients never contend on a
 * shared lock.
 *
 * <p>
 * Memory is bounded two ways:
 * <ul>
 * <li>State untouched for {@code idleExpiry} is evicted</li>
 * <li>At most {@code maxTrackedKeys} clients are tracked; least recently used state goes first</li>
 * </ul>
 *
 * <p>
 * State is not shared across instances and is lost on restart.
 */
public final class InMemoryRateLimiter implements RateLimiter {

    private final Cache<String, RateLimitState> states;
    private final AlgorithmRegistry algorithmRegistry;
    private final RateLimitAlgorithm algorithm;
    private final Clock clock;

    /**
     * Creates a new in-memory rate limiter.
     *
     * @param algorithmRegistry the algorithm registry
     * @param algorithm         the algorithm to use
     * @param idleExpiry        how long an untouched client's state is kept
     * @param maxTrackedKeys    the maximum number of clients tracked at once
     * @param clock             time source for decisions and expiry
     */
    public InMemoryRateLimiter(
            AlgorithmRegistry algorithmRegistry,
            RateLimitAlgorithm algorithm,
            Duration idleExpiry,
            long maxTrackedKeys,
            Clock clock) {
        this(algorithmRegistry, algorithm, idleExpiry, maxTrackedKeys, clock, null);
    }

    InMemoryRateLimiter(
            AlgorithmRegistry algorithmRegistry,
            RateLimitAlgorithm algorithm,
            Duration idleExpiry,
            long maxTrackedKeys,
            Clock clock,
            Executor maintenanceExecutor) {
        this.algorithmRegistry = algorithmRegistry;
        this.algorithm = algorithm;
        this.clock = clock;

        final var builder = Caffeine.newBuilder()
                .expireAfterAccess(idleExpiry)
                .maximumSize(maxTrackedKeys)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()));
        if (maintenanceExecutor != null) {
            builder.executor(maintenanceExecutor);
        }
        this.states = builder.build();
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, EffectiveRateLimit limit) {
        final var cacheKey = key.toCacheKey();
        final var handler = algorithmRegistry.getHandler(algorithm);

        return Uni.createFrom().item(() -> computeDecision(cacheKey, handler, limit));
    }

    @Override
    public Uni<RateLimitDecision> getStatus(RateLimitKey key, EffectiveRateLimit limit) {
        final var cacheKey = key.toCacheKey();
        final var handler = algorithmRegistry.getHandler(algorithm);

        return Uni.createFrom().item(() -> {
            final var currentState = states.getIfPresent(cacheKey);
            return handler.getStatus(currentState, limit, clock.millis());
        });
    }

    @Override
    public Uni<Void> reset(RateLimitKey key) {
        states.invalidate(key.toCacheKey());
        return Uni.createFrom().voidItem();
    }

    @Override
    public long activeKeyCount() {
        states.cleanUp();
        return states.estimatedSize();
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    private RateLimitDecision computeDecision(
            String cacheKey, RateLimitAlgorithmHandler handler, EffectiveRateLimit limit) {

        final var result = new RateLimitDecision[1];

        states.asMap().compute(cacheKey, (k, currentState) -> {
            // Read the clock inside the per-key critical section so decisions follow admission order
            final var decision = handler.checkAndConsume(currentState, limit, clock.millis());
            result[0] = decision;
            return decision.newState();
        });

        return result[0];
    }
}
