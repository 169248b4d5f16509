package tollgate.adapter.out.quota.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tollgate.adapter.out.quota.memory.InMemoryQuotaLimiter;
import tollgate.adapter.out.redis.RedisTimeoutHelper;
import tollgate.core.model.quota.QuotaPolicy;
import tollgate.core.model.quota.QuotaSource;
import tollgate.core.port.out.AccessMetrics;
import tollgate.support.MutableClock;

@DisplayName("RedisQuotaLimiter")
@ExtendWith(MockitoExtension.class)
class RedisQuotaLimiterTest {

    private static final String KEY = "tollgate:quota:bucket";
    private static final QuotaPolicy POLICY = new QuotaPolicy(10, 1.0);

    @Mock
    private ReactiveRedisDataSource dataSource;

    @Mock
    private AccessMetrics metrics;

    private InMemoryQuotaLimiter fallback;
    private RedisQuotaLimiter limiter;

    @BeforeEach
    void setUp() {
        fallback = new InMemoryQuotaLimiter(POLICY, MutableClock.atEpochMillis(1_700_000_000_000L));
        var helper = new RedisTimeoutHelper(Duration.ofMillis(100), metrics, "RedisQuotaLimiter");
        limiter = new RedisQuotaLimiter(dataSource, POLICY, KEY, Duration.ofHours(1), helper, metrics, fallback);
    }

    private static Response scriptResult(long granted, String tokens) {
        var response = mock(Response.class);
        var grantedPart = mock(Response.class);
        var tokensPart = mock(Response.class);
        when(response.size()).thenReturn(2);
        when(response.get(0)).thenReturn(grantedPart);
        when(response.get(1)).thenReturn(tokensPart);
        when(grantedPart.toLong()).thenReturn(granted);
        when(tokensPart.toString()).thenReturn(tokens);
        return response;
    }

    private void givenScriptReturns(Uni<Response> result) {
        when(dataSource.execute(eq("EVAL"), any(String[].class))).thenReturn(result);
    }

    @Nested
    @DisplayName("tryConsume()")
    class TryConsume {

        @Test
        @DisplayName("should return the coordinated grant")
        void shouldReturnCoordinatedGrant() {
            givenScriptReturns(Uni.createFrom().item(scriptResult(1, "9")));

            var decision = limiter.tryConsume(1).await().indefinitely();

            assertTrue(decision.granted());
            assertEquals(QuotaSource.COORDINATED, decision.source());
            assertEquals(9L, decision.remainingCalls());
            assertFalse(limiter.isDegraded());
        }

        @Test
        @DisplayName("should return the coordinated denial with retry-after for the shortfall")
        void shouldReturnCoordinatedDenial() {
            givenScriptReturns(Uni.createFrom().item(scriptResult(0, "0.25")));

            var decision = limiter.tryConsume(1).await().indefinitely();

            assertFalse(decision.granted());
            assertEquals(QuotaSource.COORDINATED, decision.source());
            assertEquals(Duration.ofMillis(750), decision.retryAfter());
        }

        @Test
        @DisplayName("should fall back to the local bucket when Redis fails and log the degradation once")
        void shouldFallBackWhenRedisFails() {
            givenScriptReturns(Uni.createFrom().failure(new RuntimeException("Connection refused")));

            var first = limiter.tryConsume(1).await().indefinitely();
            var second = limiter.tryConsume(1).await().indefinitely();

            assertEquals(QuotaSource.LOCAL, first.source());
            assertEquals(QuotaSource.LOCAL, second.source());
            assertEquals(8.0, fallback.availableNow(), 1e-9);
            assertTrue(limiter.isDegraded());
            verify(metrics, times(1)).recordDegradation("quota");
        }

        @Test
        @DisplayName("should fall back when Redis does not answer in time")
        void shouldFallBackOnTimeout() {
            givenScriptReturns(Uni.createFrom().nothing());

            var decision = limiter.tryConsume(1).await().indefinitely();

            assertEquals(QuotaSource.LOCAL, decision.source());
            verify(metrics).recordRedisTimeout("RedisQuotaLimiter", "tryConsume");
        }

        @Test
        @DisplayName("should resume coordinated metering once Redis answers again")
        void shouldRecover() {
            var recovered = scriptResult(1, "5");
            when(dataSource.execute(eq("EVAL"), any(String[].class)))
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("Connection refused")))
                    .thenReturn(Uni.createFrom().item(recovered));

            limiter.tryConsume(1).await().indefinitely();
            assertTrue(limiter.isDegraded());

            var decision = limiter.tryConsume(1).await().indefinitely();

            assertEquals(QuotaSource.COORDINATED, decision.source());
            assertFalse(limiter.isDegraded());
        }

        @Test
        @DisplayName("should reject non-positive permits")
        void shouldRejectNonPositivePermits() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> limiter.tryConsume(0).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("availableTokens()")
    class AvailableTokens {

        @Test
        @DisplayName("should read the coordinated token count")
        void shouldReadCoordinatedCount() {
            var response = mock(Response.class);
            when(response.toString()).thenReturn("7.5");
            givenScriptReturns(Uni.createFrom().item(response));

            assertEquals(7.5, limiter.availableTokens().await().indefinitely(), 1e-9);
        }

        @Test
        @DisplayName("should report the local count when Redis fails")
        void shouldReportLocalCountOnFailure() {
            givenScriptReturns(Uni.createFrom().failure(new RuntimeException("Connection refused")));

            assertEquals(10.0, limiter.availableTokens().await().indefinitely(), 1e-9);
            assertTrue(limiter.isDegraded());
        }
    }

    @Nested
    @DisplayName("bucket key expiry")
    class BucketKeyExpiry {

        @Test
        @DisplayName("should keep a daily bucket for at least two full refills")
        void shouldOutliveFullRefillOfDailyQuota() {
            var daily = QuotaPolicy.of(24_000, Duration.ofDays(1));
            var helper = new RedisTimeoutHelper(Duration.ofMillis(100), metrics, "RedisQuotaLimiter");
            var dailyLimiter = new RedisQuotaLimiter(
                    dataSource, daily, KEY, Duration.ofHours(1), helper, metrics, new InMemoryQuotaLimiter(daily));
            var granted = scriptResult(1, "23999");
            var sentTtl = new AtomicReference<String>();
            when(dataSource.execute(eq("EVAL"), any(String[].class))).thenAnswer(invocation -> {
                // EVAL script numkeys KEYS[1] ARGV[1..4]
                sentTtl.set((String) invocation.getArguments()[7]);
                return Uni.createFrom().item(granted);
            });

            dailyLimiter.tryConsume(1).await().indefinitely();

            var ttlSeconds = Long.parseLong(sentTtl.get());
            var fullRefillSeconds = Duration.ofDays(1).toSeconds();
            assertTrue(ttlSeconds >= 2 * fullRefillSeconds, "bucket key expires after " + ttlSeconds + "s");
            assertTrue(ttlSeconds <= 2 * fullRefillSeconds + 2);
        }

        @Test
        @DisplayName("should keep the configured TTL when it outlasts a full refill")
        void shouldKeepLongerConfiguredTtl() {
            assertEquals(3600, RedisQuotaLimiter.bucketTtlSeconds(POLICY, Duration.ofHours(1)));
        }

        @Test
        @DisplayName("should raise a short configured TTL to twice the refill time")
        void shouldRaiseShortConfiguredTtl() {
            assertEquals(20, RedisQuotaLimiter.bucketTtlSeconds(POLICY, Duration.ofSeconds(5)));
        }
    }
}
