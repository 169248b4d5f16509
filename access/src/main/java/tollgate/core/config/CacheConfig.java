package tollgate.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the tiered response cache.
 *
 * <p>Configuration prefix: {@code tollgate.cache}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TOLLGATE_CACHE_MEMORY_TTL} - e.g., "PT1H"</li>
 *   <li>{@code TOLLGATE_CACHE_SHARED_ENABLED} - use the Redis tier</li>
 *   <li>{@code TOLLGATE_CACHE_DISK_DIRECTORY} - where disk entries are written</li>
 * </ul>
 */
@ConfigMapping(prefix = "tollgate.cache")
public interface CacheConfig {

    /**
     * Process-local (L1) tier.
     */
    MemoryConfig memory();

    /**
     * Shared key-value store (L2) tier.
     */
    SharedConfig shared();

    /**
     * Local persistent (L3) tier.
     */
    DiskConfig disk();

    interface MemoryConfig {

        /**
         * @return TTL for memory entries (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration ttl();

        /**
         * Maximum number of entries held in memory. Least recently used entries are
         * evicted first when the bound is reached.
         *
         * @return maximum entries (default: 10000)
         */
        @WithDefault("10000")
        long maxEntries();

        /**
         * TTL jitter factor between 0.0 and 0.5.
         *
         * @return jitter factor (default: 0, no jitter)
         */
        @WithDefault("0.0")
        double jitterFactor();
    }

    interface SharedConfig {

        /**
         * Enable the Redis tier. When disabled or when no Redis client is available
         * the cache runs with the memory and disk tiers only.
         *
         * @return true to use Redis (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * @return TTL for shared entries (default: 24 hours)
         */
        @WithDefault("PT24H")
        Duration ttl();

        /**
         * Key prefix, allowing several applications to share a Redis instance.
         *
         * @return key prefix (default: "tollgate:cache:")
         */
        @WithDefault("tollgate:cache:")
        String keyPrefix();
    }

    interface DiskConfig {

        /**
         * @return true to use the disk tier (default: true)
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * @return TTL for disk entries (default: 7 days)
         */
        @WithDefault("P7D")
        Duration ttl();

        /**
         * @return directory holding one file per entry
         */
        @WithDefault("${java.io.tmpdir}/tollgate-cache")
        String directory();
    }
}
