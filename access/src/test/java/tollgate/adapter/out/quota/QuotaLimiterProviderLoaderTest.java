package tollgate.adapter.out.quota;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.time.Duration;

import jakarta.enterprise.inject.Instance;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tollgate.adapter.out.quota.memory.InMemoryQuotaLimiter;
import tollgate.adapter.out.quota.redis.RedisQuotaLimiter;
import tollgate.core.config.QuotaConfig;
import tollgate.core.config.ResiliencyConfig;
import tollgate.core.port.out.AccessMetrics;

@DisplayName("QuotaLimiterProviderLoader")
@ExtendWith(MockitoExtension.class)
class QuotaLimiterProviderLoaderTest {

    @Mock
    private Instance<ReactiveRedisDataSource> redisInstance;

    @Mock
    private ReactiveRedisDataSource dataSource;

    @Mock
    private ReactiveKeyCommands<String> keyCommands;

    @Mock
    private AccessMetrics metrics;

    private QuotaLimiterProviderLoader loader(boolean redisEnabled) {
        return new QuotaLimiterProviderLoader(
                new TestQuotaConfig(redisEnabled), new TestResiliencyConfig(), redisInstance, metrics);
    }

    @Test
    @DisplayName("should select the Redis limiter when Redis is enabled and available")
    void shouldSelectRedis() {
        when(redisInstance.isResolvable()).thenReturn(true);
        when(redisInstance.get()).thenReturn(dataSource);
        lenient().when(dataSource.key(String.class)).thenReturn(keyCommands);

        var limiter = loader(true).produceQuotaLimiter();

        assertInstanceOf(RedisQuotaLimiter.class, limiter);
        assertEquals(5000, limiter.policy().capacity());
    }

    @Test
    @DisplayName("should fall back to the in-memory limiter when no Redis client is available")
    void shouldFallBackWhenRedisUnavailable() {
        when(redisInstance.isResolvable()).thenReturn(false);

        assertInstanceOf(InMemoryQuotaLimiter.class, loader(true).produceQuotaLimiter());
    }

    @Test
    @DisplayName("should use the in-memory limiter when Redis is disabled")
    void shouldUseInMemoryWhenDisabled() {
        assertInstanceOf(InMemoryQuotaLimiter.class, loader(false).produceQuotaLimiter());
    }

    private record TestQuotaConfig(boolean redisEnabled) implements QuotaConfig {

        @Override
        public long callsPerWindow() {
            return 5000;
        }

        @Override
        public Duration window() {
            return Duration.ofHours(1);
        }

        @Override
        public long lowWaterMark() {
            return 100;
        }

        @Override
        public Duration maxWait() {
            return Duration.ofSeconds(30);
        }

        @Override
        public RedisConfig redis() {
            return new RedisConfig() {
                @Override
                public boolean enabled() {
                    return redisEnabled;
                }

                @Override
                public String key() {
                    return "tollgate:quota:bucket";
                }

                @Override
                public Duration keyTtl() {
                    return Duration.ofHours(1);
                }
            };
        }
    }

    private static final class TestResiliencyConfig implements ResiliencyConfig {

        @Override
        public RedisConfig redis() {
            return new RedisConfig() {
                @Override
                public Duration operationTimeout() {
                    return Duration.ofSeconds(1);
                }

                @Override
                public Duration probeTimeout() {
                    return Duration.ofSeconds(2);
                }
            };
        }
    }
}
