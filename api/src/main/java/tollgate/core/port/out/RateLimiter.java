package tollgate.core.port.out;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.ratelimit.EffectiveRateLimit;
import tollgate.core.model.ratelimit.RateLimitDecision;
import tollgate.core.model.ratelimit.RateLimitKey;

/**
 * Port interface for rate limiting operations.
 *
 * <p>Implementations handle the actual rate limit checking and state management.
 *
 * <p>All operations are non-blocking and return reactive types.
 */
public interface RateLimiter {

    /**
     * Check if a request is allowed and record it if so.
     *
     * <p>This is an atomic operation per key that:
     * <ol>
     *   <li>Retrieves current rate limit state</li>
     *   <li>Applies the configured algorithm to determine if allowed</li>
     *   <li>Updates state</li>
     *   <li>Returns the decision with updated state</li>
     * </ol>
     *
     * <p>Concurrent calls for the same key are serialized; calls for different keys
     * do not block each other.
     *
     * @param key the rate limit key identifying the client
     * @param limit the effective rate limit to apply
     * @return a decision indicating whether the request is allowed
     */
    Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, EffectiveRateLimit limit);

    /**
     * Get the current rate limit status without consuming capacity.
     *
     * @param key the rate limit key
     * @param limit the effective rate limit
     * @return the current status
     */
    Uni<RateLimitDecision> getStatus(RateLimitKey key, EffectiveRateLimit limit);

    /**
     * Reset the rate limit for a specific key.
     *
     * <p>This is typically used for administrative purposes or testing.
     *
     * @param key the rate limit key to reset
     * @return completion signal
     */
    Uni<Void> reset(RateLimitKey key);

    /**
     * Number of clients currently holding rate limit state.
     *
     * @return the approximate number of tracked keys
     */
    long activeKeyCount();

    /**
     * Check if rate limiting is enabled.
     *
     * @return true if rate limiting is active
     */
    boolean isEnabled();
}
