package tollgate.adapter.out.quota.redis;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import tollgate.adapter.out.quota.memory.InMemoryQuotaLimiter;
import tollgate.adapter.out.redis.RedisTimeoutHelper;
import tollgate.core.model.quota.QuotaDecision;
import tollgate.core.model.quota.QuotaPolicy;
import tollgate.core.model.quota.QuotaSource;
import tollgate.core.port.out.AccessMetrics;
import tollgate.core.port.out.QuotaLimiter;

/**
 * Redis-based quota limiter shared by every process using the same API credential.
 *
 * <p>The bucket lives in one Redis hash and is refilled and consumed by a single Lua
 * script, so concurrent callers in any process see a consistent token count. The
 * script reads time from the Redis server, giving all processes one clock.
 *
 * <p>When Redis times out or fails, the call is decided by an embedded in-memory
 * bucket instead. Moving into and out of that degraded mode is logged once per
 * transition. Every call tries Redis first, so recovery is picked up immediately.
 *
 * <p>Key format: {@code {key}} with fields {@code tokens} and {@code last_refill_ms}.
 */
public final class RedisQuotaLimiter implements QuotaLimiter {

    private static final Logger LOG = Logger.getLogger(RedisQuotaLimiter.class);

    /**
     * Lua script for atomic token bucket consumption.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the bucket key</li>
     *   <li>ARGV[1] - bucket capacity (max tokens)</li>
     *   <li>ARGV[2] - refill rate (tokens per second)</li>
     *   <li>ARGV[3] - permits requested</li>
     *   <li>ARGV[4] - key TTL in seconds</li>
     * </ol>
     *
     * <p>Returns array: [granted (0/1), tokens remaining as a string]
     */
    static final String CONSUME_SCRIPT =
            """
            local key = KEYS[1]
            local capacity = tonumber(ARGV[1])
            local refill_rate = tonumber(ARGV[2])
            local permits = tonumber(ARGV[3])
            local ttl_seconds = tonumber(ARGV[4])

            local time = redis.call('TIME')
            local now_ms = tonumber(time[1]) * 1000 + math.floor(tonumber(time[2]) / 1000)

            local data = redis.call('HMGET', key, 'tokens', 'last_refill_ms')
            local tokens = tonumber(data[1])
            local last_refill_ms = tonumber(data[2])

            if tokens == nil or last_refill_ms == nil then
                tokens = capacity
                last_refill_ms = now_ms
            end

            -- Refill; the timestamp never moves backwards
            local elapsed_ms = math.max(0, now_ms - last_refill_ms)
            tokens = math.min(capacity, tokens + (elapsed_ms / 1000.0) * refill_rate)
            last_refill_ms = math.max(last_refill_ms, now_ms)

            local granted = 0
            if tokens >= permits then
                tokens = tokens - permits
                granted = 1
            end

            redis.call('HSET', key, 'tokens', tostring(tokens), 'last_refill_ms', tostring(last_refill_ms))
            redis.call('EXPIRE', key, ttl_seconds)

            return {granted, tostring(tokens)}
            """;

    /**
     * Lua script reading the refilled token count without consuming or writing.
     *
     * <p>Arguments: KEYS[1] bucket key, ARGV[1] capacity, ARGV[2] refill rate.
     * Returns the tokens available as a string.
     */
    static final String STATUS_SCRIPT =
            """
            local key = KEYS[1]
            local capacity = tonumber(ARGV[1])
            local refill_rate = tonumber(ARGV[2])

            local data = redis.call('HMGET', key, 'tokens', 'last_refill_ms')
            local tokens = tonumber(data[1])
            local last_refill_ms = tonumber(data[2])

            if tokens == nil or last_refill_ms == nil then
                return tostring(capacity)
            end

            local time = redis.call('TIME')
            local now_ms = tonumber(time[1]) * 1000 + math.floor(tonumber(time[2]) / 1000)
            local elapsed_ms = math.max(0, now_ms - last_refill_ms)
            return tostring(math.min(capacity, tokens + (elapsed_ms / 1000.0) * refill_rate))
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final QuotaPolicy policy;
    private final String key;
    private final long keyTtlSeconds;
    private final RedisTimeoutHelper timeoutHelper;
    private final AccessMetrics metrics;
    private final InMemoryQuotaLimiter fallback;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    public RedisQuotaLimiter(
            ReactiveRedisDataSource redisDataSource,
            QuotaPolicy policy,
            String key,
            Duration keyTtl,
            RedisTimeoutHelper timeoutHelper,
            AccessMetrics metrics,
            InMemoryQuotaLimiter fallback) {
        this.redisDataSource = redisDataSource;
        this.policy = policy;
        this.key = key;
        this.keyTtlSeconds = bucketTtlSeconds(policy, keyTtl);
        this.timeoutHelper = timeoutHelper;
        this.metrics = metrics;
        this.fallback = fallback;
    }

    @Override
    public Uni<QuotaDecision> tryConsume(int permits) {
        if (permits <= 0) {
            return Uni.createFrom().failure(new IllegalArgumentException("permits must be positive"));
        }

        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        CONSUME_SCRIPT,
                        "1", // numkeys
                        key, // KEYS[1]
                        String.valueOf(policy.capacity()), // ARGV[1]
                        String.valueOf(policy.refillRatePerSecond()), // ARGV[2]
                        String.valueOf(permits), // ARGV[3]
                        String.valueOf(keyTtlSeconds) // ARGV[4]
                        )
                .map(response -> parseDecision(response, permits))
                .invoke(this::markRecovered);

        return timeoutHelper.withTimeoutFallback(operation, "tryConsume", () -> {
            markDegraded();
            return fallback.consumeNow(permits);
        });
    }

    @Override
    public Uni<Double> availableTokens() {
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        STATUS_SCRIPT,
                        "1",
                        key,
                        String.valueOf(policy.capacity()),
                        String.valueOf(policy.refillRatePerSecond()))
                .map(this::parseTokens)
                .invoke(this::markRecovered);

        return timeoutHelper.withTimeoutFallback(operation, "availableTokens", () -> {
            markDegraded();
            return fallback.availableNow();
        });
    }

    @Override
    public QuotaPolicy policy() {
        return policy;
    }

    /**
     * Returns whether the last call was decided by the local fallback bucket.
     *
     * @return true while Redis is unavailable
     */
    public boolean isDegraded() {
        return degraded.get();
    }

    /**
     * Expiry of the bucket key: the configured TTL, but never less than twice the time a
     * drained bucket takes to refill. An expired key is recreated full, so a shorter
     * expiry would hand out tokens that have not refilled yet.
     */
    static long bucketTtlSeconds(QuotaPolicy policy, Duration configuredTtl) {
        final var fullRefillMillis = policy.timeToRefill(policy.capacity()).toMillis();
        final var fullRefillSeconds = (fullRefillMillis + 999) / 1000;
        return Math.max(Math.max(1, configuredTtl.toSeconds()), 2 * fullRefillSeconds);
    }

    private QuotaDecision parseDecision(Response response, int permits) {
        if (response == null || response.size() < 2) {
            throw new IllegalStateException("Unexpected response from quota script: " + response);
        }
        final var granted = response.get(0).toLong() == 1L;
        final var tokens = Double.parseDouble(response.get(1).toString());
        if (granted) {
            return QuotaDecision.granted(tokens, QuotaSource.COORDINATED, null);
        }
        return QuotaDecision.denied(tokens, policy.timeToRefill(permits - tokens), QuotaSource.COORDINATED, null);
    }

    private double parseTokens(Response response) {
        if (response == null) {
            throw new IllegalStateException("Null response from quota status script");
        }
        return Double.parseDouble(response.toString());
    }

    private void markDegraded() {
        if (degraded.compareAndSet(false, true)) {
            LOG.warnv("Redis quota bucket {0} unavailable, metering locally until it recovers", key);
            metrics.recordDegradation("quota");
        }
    }

    private void markRecovered() {
        if (degraded.compareAndSet(true, false)) {
            LOG.infov("Redis quota bucket {0} reachable again, resuming coordinated metering", key);
        }
    }
}
