package tollgate.core.cache;

import java.util.Optional;

/**
 * Local in-memory cache interface with TTL support.
 *
 * <p>
 * Entries expire automatically after the TTL the implementation was built
 * with. Used as the process-local tier in front of the shared and disk tiers.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    /**
     * Gets a value from the cache.
     *
     * @param key the cache key
     * @return Optional containing the value if present and not expired
     */
    Optional<V> get(K key);

    /**
     * Puts a value into the cache, restarting its TTL.
     *
     * @param key   the cache key
     * @param value the value to cache
     */
    void put(K key, V value);

    /**
     * Invalidates (removes) a specific cache entry.
     *
     * @param key the cache key to invalidate
     */
    void invalidate(K key);

    /**
     * Invalidates all entries in the cache.
     */
    void invalidateAll();

    /**
     * Returns the estimated number of entries in the cache.
     *
     * @return estimated entry count
     */
    long estimatedSize();
}
