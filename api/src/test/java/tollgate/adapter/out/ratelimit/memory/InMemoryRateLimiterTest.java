package tollgate.adapter.out.ratelimit.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tollgate.core.model.gateway.ClientIdentity;
import tollgate.core.model.ratelimit.AlgorithmRegistry;
import tollgate.core.model.ratelimit.EffectiveRateLimit;
import tollgate.core.model.ratelimit.RateLimitAlgorithm;
import tollgate.core.model.ratelimit.RateLimitDecision;
import tollgate.core.model.ratelimit.RateLimitKey;
import tollgate.core.model.ratelimit.SlidingWindowState;
import tollgate.support.MutableClock;

@DisplayName("InMemoryRateLimiter")
class InMemoryRateLimiterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final long T0 = 1_700_000_000_000L;

    private MutableClock clock;
    private InMemoryRateLimiter rateLimiter;
    private EffectiveRateLimit limit;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        limit = EffectiveRateLimit.of(3, 60);
        rateLimiter = newLimiter(clock, Duration.ofMinutes(2), 1_000);
    }

    private InMemoryRateLimiter newLimiter(Clock clock, Duration idleExpiry, long maxKeys) {
        return new InMemoryRateLimiter(
                new AlgorithmRegistry(),
                RateLimitAlgorithm.SLIDING_WINDOW,
                idleExpiry,
                maxKeys,
                clock,
                Runnable::run);
    }

    private static RateLimitKey key(String subject) {
        return RateLimitKey.of(ClientIdentity.subject(subject));
    }

    private RateLimitDecision check(RateLimitKey key) {
        return rateLimiter.checkAndConsume(key, limit).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("Basic operations")
    class BasicOperationTests {

        @Test
        @DisplayName("should allow requests until the limit and reject the next one")
        void shouldRejectAfterLimit() {
            var key = key("alice");

            assertTrue(check(key).allowed());
            assertTrue(check(key).allowed());
            assertTrue(check(key).allowed());
            var rejected = check(key);

            assertFalse(rejected.allowed());
            assertEquals(60, rejected.retryAfterSeconds());
        }

        @Test
        @DisplayName("should keep clients isolated from each other")
        void shouldIsolateClients() {
            for (int i = 0; i < 3; i++) {
                check(key("alice"));
            }

            assertFalse(check(key("alice")).allowed());
            assertTrue(check(key("bob")).allowed());
        }

        @Test
        @DisplayName("should keep subject and address identities apart")
        void shouldSeparateIdentityKinds() {
            for (int i = 0; i < 3; i++) {
                check(key("10.0.0.1"));
            }

            var address = RateLimitKey.of(ClientIdentity.address("10.0.0.1"));
            assertTrue(check(address).allowed());
        }

        @Test
        @DisplayName("should admit again after the window slides past the oldest request")
        void shouldRecoverAfterWindow() {
            var key = key("alice");
            check(key);
            clock.advance(Duration.ofSeconds(10));
            check(key);
            check(key);
            assertFalse(check(key).allowed());

            clock.advance(Duration.ofSeconds(50));

            assertTrue(check(key).allowed());
            assertFalse(check(key).allowed());
        }

        @Test
        @DisplayName("should report status without consuming quota")
        void shouldNotConsumeOnStatus() {
            var key = key("alice");
            check(key);

            var status = rateLimiter.getStatus(key, limit).await().atMost(TIMEOUT);

            assertEquals(2, status.remaining());
            assertEquals(1, check(key).remaining(), "The status call did not count");
        }

        @Test
        @DisplayName("should forget a client on reset")
        void shouldResetClient() {
            var key = key("alice");
            for (int i = 0; i < 3; i++) {
                check(key);
            }

            rateLimiter.reset(key).await().atMost(TIMEOUT);

            assertTrue(check(key).allowed());
        }
    }

    @Nested
    @DisplayName("Memory bounds")
    class MemoryBoundTests {

        @Test
        @DisplayName("should evict clients idle for the configured period")
        void shouldEvictIdleClients() {
            check(key("alice"));
            check(key("bob"));
            assertEquals(2, rateLimiter.activeKeyCount());

            clock.advance(Duration.ofMinutes(1));
            check(key("bob"));
            clock.advance(Duration.ofSeconds(61));

            assertEquals(1, rateLimiter.activeKeyCount(), "Only the recently active client remains");
        }

        @Test
        @DisplayName("should cap the number of tracked clients")
        void shouldCapTrackedClients() {
            var bounded = newLimiter(clock, Duration.ofMinutes(2), 5);

            for (int i = 0; i < 50; i++) {
                bounded.checkAndConsume(key("client-" + i), limit).await().atMost(TIMEOUT);
            }

            assertTrue(bounded.activeKeyCount() <= 5, "Tracked clients must stay within the cap");
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should admit exactly the limit under concurrent bursts for one client")
        void shouldAdmitExactlyLimitUnderBurst() throws Exception {
            var burstLimit = EffectiveRateLimit.of(10, 60);
            var key = key("burst");
            var admitted = new AtomicInteger();
            var start = new CountDownLatch(1);
            var executor = Executors.newFixedThreadPool(16);

            try {
                var done = new CountDownLatch(200);
                for (int i = 0; i < 200; i++) {
                    executor.submit(() -> {
                        try {
                            start.await();
                            var decision = rateLimiter
                                    .checkAndConsume(key, burstLimit)
                                    .await()
                                    .atMost(TIMEOUT);
                            if (decision.allowed()) {
                                admitted.incrementAndGet();
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } finally {
                            done.countDown();
                        }
                    });
                }
                start.countDown();
                assertTrue(done.await(10, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            assertEquals(10, admitted.get());
        }

        @Test
        @DisplayName("should never admit more than the limit in any trailing window under random arrivals")
        void shouldHoldBoundUnderRandomArrivals() throws Exception {
            var windowMillis = 1_000L;
            var randomLimit = new EffectiveRateLimit(7, Duration.ofMillis(windowMillis));
            var drifting = new DriftingClock(T0);
            var limiter = newLimiter(drifting, Duration.ofMinutes(10), 1_000);
            var key = key("random");
            var admittedAt = Collections.synchronizedList(new ArrayList<Long>());
            var executor = Executors.newFixedThreadPool(8);

            try {
                var done = new CountDownLatch(8);
                for (int t = 0; t < 8; t++) {
                    executor.submit(() -> {
                        try {
                            for (int i = 0; i < 400; i++) {
                                var decision = limiter.checkAndConsume(key, randomLimit)
                                        .await()
                                        .atMost(TIMEOUT);
                                if (decision.allowed()) {
                                    var timestamps = ((SlidingWindowState) decision.newState()).admittedAtMillis();
                                    admittedAt.add(timestamps[timestamps.length - 1]);
                                }
                            }
                        } finally {
                            done.countDown();
                        }
                    });
                }
                assertTrue(done.await(30, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            List<Long> sorted = new ArrayList<>(admittedAt);
            Collections.sort(sorted);
            assertTrue(sorted.size() > 7, "Clock drift should open several windows");
            for (int i = 0; i < sorted.size(); i++) {
                var end = sorted.get(i);
                var inWindow = sorted.stream()
                        .filter(ts -> ts > end - windowMillis && ts <= end)
                        .count();
                assertTrue(inWindow <= 7, "Window ending at " + end + " admitted " + inWindow);
            }
        }
    }

    /**
     * Moves forward by a random step on every read.
     */
    private static final class DriftingClock extends Clock {

        private final AtomicLong millis;

        DriftingClock(long startMillis) {
            this.millis = new AtomicLong(startMillis);
        }

        @Override
        public long millis() {
            return millis.addAndGet(ThreadLocalRandom.current().nextLong(0, 3));
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis());
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
