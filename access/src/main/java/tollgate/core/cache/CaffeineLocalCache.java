package tollgate.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Bounded in-process cache on top of Caffeine.
 *
 * <p>Entries live for the configured TTL from their last write, and the least
 * recently used entries are evicted once {@code maxSize} is reached. Reads do not
 * extend an entry's life.
 *
 * <p>With a non-zero jitter factor {@code j}, each write draws its TTL uniformly from
 * {@code [ttl * (1 - j), ttl * (1 + j)]}. Processes that filled their memory tier
 * from Redis at the same moment then fall back to Redis at different moments.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private static final double MAX_JITTER = 0.5;

    private final Cache<K, V> cache;

    public CaffeineLocalCache(Duration ttl, long maxSize) {
        this(ttl, maxSize, 0.0, Ticker.systemTicker());
    }

    public CaffeineLocalCache(Duration ttl, long maxSize, double jitterFactor) {
        this(ttl, maxSize, jitterFactor, Ticker.systemTicker());
    }

    /**
     * Create a cache reading time from the given ticker.
     *
     * @param ttl          time-to-live counted from the last write
     * @param maxSize      maximum number of entries
     * @param jitterFactor relative TTL spread, between 0.0 and 0.5
     * @param ticker       time source for expiry
     */
    public CaffeineLocalCache(Duration ttl, long maxSize, double jitterFactor, Ticker ticker) {
        if (jitterFactor < 0.0 || jitterFactor > MAX_JITTER) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitterFactor);
        }

        final var builder = Caffeine.newBuilder().maximumSize(maxSize).ticker(ticker);
        this.cache = jitterFactor == 0.0
                ? builder.expireAfterWrite(ttl).build()
                : builder.expireAfter(new WriteJitterExpiry<K, V>(ttl.toNanos(), jitterFactor)).build();
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static final class WriteJitterExpiry<K, V> implements Expiry<K, V> {

        private final long ttlNanos;
        private final double jitterFactor;

        WriteJitterExpiry(long ttlNanos, double jitterFactor) {
            this.ttlNanos = ttlNanos;
            this.jitterFactor = jitterFactor;
        }

        @Override
        public long expireAfterCreate(K key, V value, long currentTime) {
            return jittered();
        }

        @Override
        public long expireAfterUpdate(K key, V value, long currentTime, long currentDuration) {
            return jittered();
        }

        @Override
        public long expireAfterRead(K key, V value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long jittered() {
            final var offset = ThreadLocalRandom.current().nextDouble(-jitterFactor, jitterFactor);
            return (long) (ttlNanos * (1.0 + offset));
        }
    }
}
