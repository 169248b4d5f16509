package tollgate.adapter.out.cache.redis;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.adapter.out.cache.CacheEntryCodec;
import tollgate.adapter.out.redis.RedisTimeoutHelper;
import tollgate.core.model.cache.CacheEntry;
import tollgate.core.model.cache.CacheTier;
import tollgate.core.port.out.ResponseCacheTier;

/**
 * Redis tier (L2) of the response cache.
 *
 * <p>Entries are stored as JSON strings under {@code {keyPrefix}{key}} with a Redis
 * expiry equal to the tier TTL. The write time inside the entry is checked on read as
 * well, so an entry never outlives the TTL even if the key expiry was extended.
 *
 * <p>Every operation is bounded by the timeout helper: a slow or unreachable Redis
 * turns reads into misses and writes into rejected writes.
 */
public class RedisResponseCache implements ResponseCacheTier {

    private static final Logger LOG = Logger.getLogger(RedisResponseCache.class);

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final Duration ttl;
    private final RedisTimeoutHelper timeoutHelper;
    private final Clock clock;

    public RedisResponseCache(
            ReactiveRedisDataSource redisDataSource,
            String keyPrefix,
            Duration ttl,
            RedisTimeoutHelper timeoutHelper,
            Clock clock) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix;
        this.ttl = ttl;
        this.timeoutHelper = timeoutHelper;
        this.clock = clock;
    }

    @Override
    public CacheTier tier() {
        return CacheTier.SHARED;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    /**
     * SETEX takes whole seconds greater than zero; the TTL is rounded up, and the
     * written-at check on read enforces the exact TTL.
     */
    private long storeExpirySeconds() {
        return Math.max(1, (ttl.toMillis() + 999) / 1000);
    }

    @Override
    public Uni<Optional<CacheEntry>> get(String key) {
        final var operation = valueCommands.get(keyPrefix + key);
        return timeoutHelper.withTimeoutGraceful(operation, "get").map(json -> json.flatMap(value -> decode(key, value)));
    }

    @Override
    public Uni<Boolean> put(CacheEntry entry) {
        final var json = CacheEntryCodec.encode(entry);
        final var operation =
                valueCommands.setex(keyPrefix + entry.key(), storeExpirySeconds(), json).replaceWith(Boolean.TRUE);
        return timeoutHelper.withTimeoutFallback(operation, "put", () -> Boolean.FALSE);
    }

    @Override
    public Uni<Void> invalidate(String key) {
        final var operation = keyCommands.del(keyPrefix + key).replaceWithVoid();
        return timeoutHelper.withTimeoutSilent(operation, "invalidate");
    }

    private Optional<CacheEntry> decode(String key, String json) {
        try {
            final var entry = CacheEntryCodec.decode(json);
            if (!key.equals(entry.key()) || entry.isExpired(ttl, clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (RuntimeException e) {
            LOG.warnv("Discarding unreadable Redis cache entry for key {0}: {1}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
