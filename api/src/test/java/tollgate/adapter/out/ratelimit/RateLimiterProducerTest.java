package tollgate.adapter.out.ratelimit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import tollgate.config.RateLimitingConfig;
import tollgate.core.model.gateway.ClientIdentity;
import tollgate.core.model.ratelimit.EffectiveRateLimit;
import tollgate.core.model.ratelimit.RateLimitAlgorithm;
import tollgate.core.model.ratelimit.RateLimitKey;

@DisplayName("RateLimiterProducer")
class RateLimiterProducerTest {

    private RateLimitingConfig config;

    @BeforeEach
    void setUp() {
        config = mock(RateLimitingConfig.class);
        when(config.enabled()).thenReturn(true);
        when(config.algorithm()).thenReturn(RateLimitAlgorithm.SLIDING_WINDOW);
        when(config.requestsPerWindow()).thenReturn(1L);
        when(config.windowSeconds()).thenReturn(60L);
        when(config.idleEvictionWindows()).thenReturn(2);
        when(config.maxTrackedClients()).thenReturn(100L);
    }

    @Test
    @DisplayName("should produce the in-memory limiter when enabled")
    void shouldProduceInMemoryLimiter() {
        var limiter = new RateLimiterProducer(config).produceRateLimiter();

        assertInstanceOf(InMemoryRateLimiter.class, limiter);
        assertTrue(limiter.isEnabled());
    }

    @Test
    @DisplayName("should produce a limiter that admits everything when disabled")
    void shouldProduceNoOpWhenDisabled() {
        when(config.enabled()).thenReturn(false);

        var limiter = new RateLimiterProducer(config).produceRateLimiter();

        assertSame(NoOpRateLimiter.getInstance(), limiter);
        assertFalse(limiter.isEnabled());
        var key = RateLimitKey.of(ClientIdentity.subject("alice"));
        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.checkAndConsume(key, EffectiveRateLimit.of(1, 60))
                    .await()
                    .atMost(Duration.ofSeconds(1))
                    .allowed());
        }
    }

    @Test
    @DisplayName("should reject a zero idle eviction period")
    void shouldRejectZeroIdleEviction() {
        when(config.idleEvictionWindows()).thenReturn(0);

        var producer = new RateLimiterProducer(config);

        assertThrows(IllegalStateException.class, producer::produceRateLimiter);
    }
}
