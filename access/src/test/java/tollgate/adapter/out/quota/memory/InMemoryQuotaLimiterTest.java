package tollgate.adapter.out.quota.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.core.model.quota.QuotaPolicy;
import tollgate.core.model.quota.QuotaSource;
import tollgate.support.MutableClock;

@DisplayName("InMemoryQuotaLimiter")
class InMemoryQuotaLimiterTest {

    private final MutableClock clock = MutableClock.atEpochMillis(1_700_000_000_000L);

    @Test
    @DisplayName("should make local decisions")
    void shouldMakeLocalDecisions() {
        var limiter = new InMemoryQuotaLimiter(new QuotaPolicy(3, 1.0), clock);

        var decision = limiter.tryConsume(1).await().indefinitely();

        assertTrue(decision.granted());
        assertEquals(QuotaSource.LOCAL, decision.source());
        assertEquals(2.0, limiter.availableTokens().await().indefinitely(), 1e-9);
    }

    @Test
    @DisplayName("should never grant more than capacity to concurrent callers")
    void shouldNotOverdrawUnderConcurrency() throws InterruptedException {
        var limiter = new InMemoryQuotaLimiter(new QuotaPolicy(100, 0.001), clock);
        var executor = Executors.newFixedThreadPool(8);
        var start = new CountDownLatch(1);
        var done = new CountDownLatch(400);
        var granted = new AtomicInteger();

        for (var i = 0; i < 400; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    if (limiter.consumeNow(1).granted()) {
                        granted.incrementAndGet();
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
        executor.shutdown();

        assertEquals(100, granted.get());
        assertTrue(limiter.availableNow() >= 0.0);
    }

    @Test
    @DisplayName("should refill with the passage of time")
    void shouldRefillWithTime() {
        var limiter = new InMemoryQuotaLimiter(new QuotaPolicy(2, 2.0), clock);
        limiter.consumeNow(2);

        clock.advance(Duration.ofMillis(500));

        assertEquals(1.0, limiter.availableNow(), 1e-9);
        assertTrue(limiter.consumeNow(1).granted());
    }
}
