package tollgate.adapter.out.ratelimit;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tollgate.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import tollgate.config.RateLimitingConfig;
import tollgate.core.model.ratelimit.AlgorithmRegistry;
import tollgate.core.model.ratelimit.EffectiveRateLimit;
import tollgate.core.port.out.RateLimiter;

/**
 * CDI producer for the rate limiter.
 *
 * <p>When rate limiting is disabled, returns a no-op implementation.
 */
@ApplicationScoped
public class RateLimiterProducer {

    private static final Logger LOG = Logger.getLogger(RateLimiterProducer.class);

    private final RateLimitingConfig config;

    @Inject
    public RateLimiterProducer(RateLimitingConfig config) {
        this.config = config;
    }

    /**
     * Produces the rate limiter instance for CDI injection.
     *
     * @return the configured rate limiter
     */
    @Produces
    @ApplicationScoped
    public RateLimiter produceRateLimiter() {
        if (!config.enabled()) {
            LOG.info("Rate limiting is disabled, using NoOpRateLimiter");
            return NoOpRateLimiter.getInstance();
        }

        if (config.idleEvictionWindows() < 1) {
            throw new IllegalStateException("tollgate.rate-limiting.idle-eviction-windows must be at least 1");
        }
        if (config.maxTrackedClients() < 1) {
            throw new IllegalStateException("tollgate.rate-limiting.max-tracked-clients must be at least 1");
        }

        final var limit = EffectiveRateLimit.of(config.requestsPerWindow(), config.windowSeconds());
        final var idleExpiry = limit.window().multipliedBy(config.idleEvictionWindows());

        LOG.infov(
                "Rate limiting enabled with algorithm={0}, limit={1}/{2}s, idleExpiry={3}, maxClients={4}",
                config.algorithm(),
                config.requestsPerWindow(),
                config.windowSeconds(),
                idleExpiry,
                config.maxTrackedClients());

        return new InMemoryRateLimiter(
                new AlgorithmRegistry(),
                config.algorithm(),
                idleExpiry,
                config.maxTrackedClients(),
                Clock.systemUTC());
    }
}
