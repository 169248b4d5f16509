package tollgate.adapter.out.quota.redis;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import tollgate.adapter.out.quota.memory.InMemoryQuotaLimiter;
import tollgate.adapter.out.redis.RedisTimeoutHelper;
import tollgate.core.model.quota.QuotaPolicy;
import tollgate.core.port.out.AccessMetrics;
import tollgate.core.port.out.QuotaLimiter;
import tollgate.spi.QuotaLimiterProvider;

/**
 * Redis-based quota limiter provider for multi-process deployments.
 *
 * <p>This provider has higher priority than in-memory (10 vs 0) and is
 * selected automatically when Redis is configured.
 */
public final class RedisQuotaLimiterProvider implements QuotaLimiterProvider {

    private static final int PRIORITY = 10;
    private static final String NAME = "redis";

    private final ReactiveRedisDataSource redisDataSource;
    private final QuotaPolicy policy;
    private final String key;
    private final Duration keyTtl;
    private final Duration operationTimeout;
    private final AccessMetrics metrics;

    public RedisQuotaLimiterProvider(
            ReactiveRedisDataSource redisDataSource,
            QuotaPolicy policy,
            String key,
            Duration keyTtl,
            Duration operationTimeout,
            AccessMetrics metrics) {
        this.redisDataSource = redisDataSource;
        this.policy = policy;
        this.key = key;
        this.keyTtl = keyTtl;
        this.operationTimeout = operationTimeout;
        this.metrics = metrics;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return redisDataSource != null;
    }

    @Override
    public QuotaLimiter createQuotaLimiter() {
        if (redisDataSource == null) {
            throw new IllegalStateException("Redis data source not available");
        }
        final var timeoutHelper = new RedisTimeoutHelper(operationTimeout, metrics, "RedisQuotaLimiter");
        return new RedisQuotaLimiter(
                redisDataSource, policy, key, keyTtl, timeoutHelper, metrics, new InMemoryQuotaLimiter(policy));
    }
}
