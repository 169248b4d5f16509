package tollgate.core.model.quota;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TokenBucketAlgorithm")
class TokenBucketAlgorithmTest {

    private static final long NOW = 1_700_000_000_000L;

    private final TokenBucketAlgorithm algorithm = TokenBucketAlgorithm.getInstance();

    // 10 tokens, 1 token per second
    private final QuotaPolicy policy = new QuotaPolicy(10, 1.0);

    @Nested
    @DisplayName("Consumption")
    class Consumption {

        @Test
        @DisplayName("should start full and grant the first call")
        void shouldStartFullAndGrant() {
            var decision = algorithm.tryConsume(null, policy, 1, NOW);

            assertTrue(decision.granted());
            assertEquals(9.0, decision.remaining(), 1e-9);
            assertEquals(Duration.ZERO, decision.retryAfter());
            assertEquals(QuotaSource.LOCAL, decision.source());
        }

        @Test
        @DisplayName("should grant exactly capacity calls then deny")
        void shouldGrantExactlyCapacityCalls() {
            BucketState state = null;
            var granted = 0;
            for (var i = 0; i < 11; i++) {
                var decision = algorithm.tryConsume(state, policy, 1, NOW);
                state = decision.newState();
                if (decision.granted()) {
                    granted++;
                }
            }

            assertEquals(10, granted);
            assertEquals(0.0, state.tokens(), 1e-9);
        }

        @Test
        @DisplayName("should leave tokens unchanged on denial and report retry-after")
        void shouldLeaveTokensUnchangedOnDenial() {
            var state = new BucketState(0.5, NOW);

            var decision = algorithm.tryConsume(state, policy, 1, NOW);

            assertFalse(decision.granted());
            assertEquals(0.5, decision.newState().tokens(), 1e-9);
            assertEquals(Duration.ofMillis(500), decision.retryAfter());
        }

        @Test
        @DisplayName("should consume several permits at once")
        void shouldConsumeSeveralPermits() {
            var decision = algorithm.tryConsume(null, policy, 4, NOW);

            assertTrue(decision.granted());
            assertEquals(6.0, decision.remaining(), 1e-9);
        }

        @Test
        @DisplayName("should reject non-positive permits")
        void shouldRejectNonPositivePermits() {
            assertThrows(IllegalArgumentException.class, () -> algorithm.tryConsume(null, policy, 0, NOW));
        }
    }

    @Nested
    @DisplayName("Refill")
    class Refill {

        @Test
        @DisplayName("should refill proportionally to elapsed time")
        void shouldRefillProportionally() {
            var state = new BucketState(2.0, NOW);

            var decision = algorithm.tryConsume(state, policy, 1, NOW + 3_500);

            assertTrue(decision.granted());
            assertEquals(4.5, decision.remaining(), 1e-9);
            assertEquals(NOW + 3_500, decision.newState().lastRefillMillis());
        }

        @Test
        @DisplayName("should never refill above capacity")
        void shouldCapAtCapacity() {
            var state = new BucketState(9.0, NOW);

            assertEquals(10.0, algorithm.available(state, policy, NOW + 60_000), 1e-9);
        }

        @Test
        @DisplayName("should not move the refill timestamp backwards")
        void shouldNotMoveBackwards() {
            var state = new BucketState(3.0, NOW);

            var decision = algorithm.tryConsume(state, policy, 1, NOW - 5_000);

            assertEquals(NOW, decision.newState().lastRefillMillis());
            assertEquals(2.0, decision.remaining(), 1e-9);
        }

        @Test
        @DisplayName("should conserve tokens: refilled minus granted")
        void shouldConserveTokens() {
            BucketState state = null;
            var granted = 0;
            // 10 initial tokens plus 5 seconds of refill at 1/s
            for (var second = 0; second <= 5; second++) {
                for (var i = 0; i < 20; i++) {
                    var decision = algorithm.tryConsume(state, policy, 1, NOW + second * 1_000L);
                    state = decision.newState();
                    if (decision.granted()) {
                        granted++;
                    }
                }
            }

            assertEquals(15, granted);
        }

        @Test
        @DisplayName("should not modify state when only reading availability")
        void shouldNotModifyOnAvailable() {
            var state = new BucketState(1.0, NOW);

            algorithm.available(state, policy, NOW + 2_000);

            assertEquals(1.0, state.tokens(), 1e-9);
        }
    }
}
