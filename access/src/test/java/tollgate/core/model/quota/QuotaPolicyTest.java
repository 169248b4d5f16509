package tollgate.core.model.quota;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("QuotaPolicy")
class QuotaPolicyTest {

    @Test
    @DisplayName("should derive capacity and refill rate from calls per window")
    void shouldDeriveFromCallsPerWindow() {
        var policy = QuotaPolicy.of(5000, Duration.ofHours(1));

        assertEquals(5000, policy.capacity());
        assertEquals(5000 / 3600.0, policy.refillRatePerSecond(), 1e-12);
    }

    @Test
    @DisplayName("should compute time to refill a shortfall, rounded up to the millisecond")
    void shouldComputeTimeToRefill() {
        var policy = new QuotaPolicy(100, 3.0);

        assertEquals(Duration.ofMillis(334), policy.timeToRefill(1));
        assertEquals(Duration.ZERO, policy.timeToRefill(0));
        assertEquals(Duration.ZERO, policy.timeToRefill(-2));
    }

    @Test
    @DisplayName("should reject invalid parameters")
    void shouldRejectInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new QuotaPolicy(0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new QuotaPolicy(10, 0.0));
        assertThrows(IllegalArgumentException.class, () -> QuotaPolicy.of(10, Duration.ZERO));
    }

    @Test
    @DisplayName("should reject negative bucket state")
    void shouldRejectNegativeBucketState() {
        assertThrows(IllegalArgumentException.class, () -> new BucketState(-1.0, 0));
    }
}
