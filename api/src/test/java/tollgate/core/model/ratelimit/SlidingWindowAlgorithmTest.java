package tollgate.core.model.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SlidingWindowAlgorithm")
class SlidingWindowAlgorithmTest {

    private static final long T0 = 1_700_000_000_000L;

    private SlidingWindowAlgorithm algorithm;
    private EffectiveRateLimit limit;

    @BeforeEach
    void setUp() {
        algorithm = SlidingWindowAlgorithm.getInstance();
        limit = EffectiveRateLimit.of(3, 60);
    }

    private RateLimitState admit(RateLimitState state, long nowMillis) {
        var decision = algorithm.checkAndConsume(state, limit, nowMillis);
        assertTrue(decision.allowed(), "Expected request at " + nowMillis + " to be admitted");
        return decision.newState();
    }

    @Nested
    @DisplayName("Algorithm identification")
    class AlgorithmIdentificationTests {

        @Test
        @DisplayName("should return SLIDING_WINDOW algorithm type")
        void shouldReturnSlidingWindowType() {
            assertEquals(RateLimitAlgorithm.SLIDING_WINDOW, algorithm.algorithm());
        }

        @Test
        @DisplayName("should return singleton instance")
        void shouldReturnSingletonInstance() {
            assertSame(SlidingWindowAlgorithm.getInstance(), SlidingWindowAlgorithm.getInstance());
        }
    }

    @Nested
    @DisplayName("Check and consume")
    class CheckAndConsumeTests {

        @Test
        @DisplayName("should admit up to the limit and count down remaining")
        void shouldAdmitUpToLimit() {
            var first = algorithm.checkAndConsume(null, limit, T0);
            var second = algorithm.checkAndConsume(first.newState(), limit, T0 + 10);
            var third = algorithm.checkAndConsume(second.newState(), limit, T0 + 20);

            assertEquals(2, first.remaining());
            assertEquals(1, second.remaining());
            assertEquals(0, third.remaining());
            assertTrue(third.allowed());
            assertEquals(3, third.newState().requestCount());
        }

        @Test
        @DisplayName("should reject once the window is full without recording the rejection")
        void shouldRejectWhenFull() {
            var state = admit(admit(admit(null, T0), T0 + 1_000), T0 + 2_000);

            var decision = algorithm.checkAndConsume(state, limit, T0 + 5_000);

            assertFalse(decision.allowed());
            assertEquals(0, decision.remaining());
            assertEquals(3, decision.newState().requestCount(), "Rejected requests are not counted");
        }

        @Test
        @DisplayName("should report retry-after as the time until the oldest request leaves the window")
        void shouldComputeRetryAfterFromOldest() {
            var state = admit(admit(admit(null, T0), T0 + 1_000), T0 + 2_000);

            var decision = algorithm.checkAndConsume(state, limit, T0 + 30_000);

            assertEquals(Duration.ofSeconds(30), decision.retryAfter());
            assertEquals(30, decision.retryAfterSeconds());
            assertEquals(T0 + 60_000, decision.resetAt().toEpochMilli());
        }

        @Test
        @DisplayName("should round retry-after up to whole seconds")
        void shouldRoundRetryAfterUp() {
            var state = admit(admit(admit(null, T0), T0), T0);

            var decision = algorithm.checkAndConsume(state, limit, T0 + 59_500);

            assertEquals(Duration.ofMillis(500), decision.retryAfter());
            assertEquals(1, decision.retryAfterSeconds());
        }

        @Test
        @DisplayName("should admit again once the oldest request is exactly one window old")
        void shouldAdmitAtWindowBoundary() {
            var state = admit(admit(admit(null, T0), T0 + 1_000), T0 + 2_000);

            var decision = algorithm.checkAndConsume(state, limit, T0 + 60_000);

            assertTrue(decision.allowed());
            assertEquals(3, decision.newState().requestCount(), "Oldest dropped, newest added");
        }

        @Test
        @DisplayName("should never admit more than the limit in any trailing window")
        void shouldNotAllowBurstAcrossBoundary() {
            // A fixed window would let 3 through at 59s and 3 more at 61s
            var state = admit(admit(admit(null, T0 + 59_000), T0 + 59_100), T0 + 59_200);

            var decision = algorithm.checkAndConsume(state, limit, T0 + 61_000);

            assertFalse(decision.allowed());
        }

        @Test
        @DisplayName("should reject everything with a zero limit and report a full window")
        void shouldRejectWithZeroLimit() {
            var zero = EffectiveRateLimit.of(0, 60);

            var decision = algorithm.checkAndConsume(null, zero, T0);

            assertFalse(decision.allowed());
            assertEquals(60, decision.retryAfterSeconds());
        }

        @Test
        @DisplayName("should discard state left by another algorithm")
        void shouldDiscardForeignState() {
            var decision = algorithm.checkAndConsume(new FixedWindowState(3, T0), limit, T0 + 1);

            assertTrue(decision.allowed());
            assertTrue(decision.newState() instanceof SlidingWindowState);
        }
    }

    @Nested
    @DisplayName("Status")
    class StatusTests {

        @Test
        @DisplayName("should report status without consuming")
        void shouldNotConsumeOnStatus() {
            var state = admit(null, T0);

            var status = algorithm.getStatus(state, limit, T0 + 10);

            assertTrue(status.allowed());
            assertEquals(2, status.remaining());
            assertEquals(1, status.newState().requestCount());
        }

        @Test
        @DisplayName("should report full quota for an unknown client")
        void shouldReportFullQuotaWhenNoState() {
            var status = algorithm.getStatus(null, limit, T0);

            assertTrue(status.allowed());
            assertEquals(3, status.remaining());
        }
    }
}
