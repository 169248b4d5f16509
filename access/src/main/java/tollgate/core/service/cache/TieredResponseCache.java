package tollgate.core.service.cache;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.cache.LocalCache;
import tollgate.core.model.cache.CacheEntry;
import tollgate.core.model.cache.CacheLookup;
import tollgate.core.model.cache.CacheTier;
import tollgate.core.port.out.AccessMetrics;
import tollgate.core.port.out.ResponseCacheTier;

/**
 * Three-tier response cache in front of the rate-limited external API.
 *
 * <p>Tiers, checked and populated in this order:
 * <ol>
 *   <li><b>L1 (Memory)</b>: Caffeine-based local cache (default TTL 1 hour)</li>
 *   <li><b>L2 (Redis)</b>: shared across processes (default TTL 24 hours), optional</li>
 *   <li><b>L3 (Disk)</b>: survives restarts (default TTL 7 days), optional</li>
 * </ol>
 *
 * <h2>Read Path</h2>
 * <pre>
 * Memory → (miss) → Redis → promote to Memory
 *                 → (miss) → Disk → promote to Memory and Redis
 * </pre>
 *
 * <h2>Write Path</h2>
 * <pre>
 * Memory (must succeed) → Redis (best effort) → Disk (best effort)
 * </pre>
 *
 * <p>Promoted entries are restamped with the promotion time, so each tier's expiry runs
 * from when that tier received the value. Failures of L2 or L3 are logged and counted
 * but never fail a lookup or a write; the cache is not a system of record.
 */
public class TieredResponseCache {

    private static final Logger LOG = Logger.getLogger(TieredResponseCache.class);

    private final LocalCache<String, CacheEntry> memoryCache;
    private final ResponseCacheTier sharedTier;
    private final ResponseCacheTier diskTier;
    private final AccessMetrics metrics;
    private final Clock clock;

    /**
     * Creates a tiered cache.
     *
     * @param memoryCache the L1 cache, configured with the memory TTL
     * @param sharedTier the L2 tier, may be null
     * @param diskTier the L3 tier, may be null
     * @param metrics metrics sink
     * @param clock time source for write stamps
     */
    public TieredResponseCache(
            LocalCache<String, CacheEntry> memoryCache,
            ResponseCacheTier sharedTier,
            ResponseCacheTier diskTier,
            AccessMetrics metrics,
            Clock clock) {
        this.memoryCache = memoryCache;
        this.sharedTier = sharedTier;
        this.diskTier = diskTier;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Get a cached payload.
     *
     * @param key the cache key
     * @return the payload, or empty on a miss in every tier
     */
    public Uni<Optional<JsonNode>> get(String key) {
        return lookup(key).map(CacheLookup::value);
    }

    /**
     * Look up a key through the tiers, promoting a hit into the faster tiers.
     *
     * @param key the cache key
     * @return the lookup outcome, including which tier served it
     */
    public Uni<CacheLookup> lookup(String key) {
        final var memoryCached = memoryCache.get(key);
        if (memoryCached.isPresent()) {
            return Uni.createFrom().item(hit(key, memoryCached.get(), CacheTier.MEMORY));
        }

        if (sharedTier != null) {
            return safeGet(sharedTier, key).flatMap(sharedCached -> {
                if (sharedCached.isPresent()) {
                    memoryCache.put(key, sharedCached.get().restamp(clock.instant()));
                    return Uni.createFrom().item(hit(key, sharedCached.get(), CacheTier.SHARED));
                }
                return lookupDisk(key);
            });
        }

        return lookupDisk(key);
    }

    private Uni<CacheLookup> lookupDisk(String key) {
        if (diskTier == null) {
            return Uni.createFrom().item(miss(key));
        }

        return safeGet(diskTier, key).flatMap(diskCached -> {
            if (diskCached.isEmpty()) {
                return Uni.createFrom().item(miss(key));
            }
            final var promoted = diskCached.get().restamp(clock.instant());
            memoryCache.put(key, promoted);
            final var result = hit(key, diskCached.get(), CacheTier.DISK);
            if (sharedTier == null) {
                return Uni.createFrom().item(result);
            }
            return writeTier(sharedTier, promoted).map(written -> result);
        });
    }

    /**
     * Write a payload to every tier.
     *
     * <p>The memory write always happens and its failure fails the returned {@link Uni}.
     * Redis and disk writes are attempted; a failure in either is logged and left out
     * of the result.
     *
     * @param key the cache key
     * @param value the payload
     * @return the tiers that accepted the write, always including {@link CacheTier#MEMORY}
     */
    public Uni<Set<CacheTier>> set(String key, JsonNode value) {
        final var entry = new CacheEntry(key, value, clock.instant());

        return Uni.createFrom()
                .item(() -> {
                    memoryCache.put(key, entry);
                    return EnumSet.of(CacheTier.MEMORY);
                })
                .flatMap(written -> appendIfWritten(sharedTier, entry, written))
                .flatMap(written -> appendIfWritten(diskTier, entry, written))
                .map(written -> {
                    LOG.debugf("Cached key %s in tiers %s", key, written);
                    return Collections.unmodifiableSet(written);
                });
    }

    /**
     * Remove a key from every tier.
     *
     * <p>Memory and Redis removal are immediate. The disk tier deletes the entry's
     * file, which it locates by hashing the key.
     *
     * @param key the cache key
     * @return completion signal
     */
    public Uni<Void> invalidate(String key) {
        memoryCache.invalidate(key);
        return invalidateTier(sharedTier, key)
                .flatMap(v -> invalidateTier(diskTier, key))
                .invoke(() -> LOG.debugf("Invalidated key %s", key));
    }

    /**
     * Returns the tiers this cache was built with, in lookup order.
     *
     * @return the active tiers
     */
    public List<CacheTier> activeTiers() {
        final var tiers = new ArrayList<CacheTier>(3);
        tiers.add(CacheTier.MEMORY);
        if (sharedTier != null) {
            tiers.add(sharedTier.tier());
        }
        if (diskTier != null) {
            tiers.add(diskTier.tier());
        }
        return List.copyOf(tiers);
    }

    private CacheLookup hit(String key, CacheEntry entry, CacheTier tier) {
        LOG.debugf("Cache hit in %s for key: %s", tier, key);
        metrics.recordCacheHit(tier);
        return CacheLookup.hit(entry.value(), tier);
    }

    private CacheLookup miss(String key) {
        LOG.debugf("Cache miss for key: %s", key);
        metrics.recordCacheMiss();
        return CacheLookup.miss();
    }

    private Uni<Optional<CacheEntry>> safeGet(ResponseCacheTier tier, String key) {
        return tier.get(key).onFailure().recoverWithItem(error -> {
            LOG.warnv("Error reading key {0} from {1} tier: {2}", key, tier.tier(), error.getMessage());
            return Optional.empty();
        });
    }

    private Uni<EnumSet<CacheTier>> appendIfWritten(
            ResponseCacheTier tier, CacheEntry entry, EnumSet<CacheTier> written) {
        if (tier == null) {
            return Uni.createFrom().item(written);
        }
        return writeTier(tier, entry).map(accepted -> {
            if (accepted) {
                written.add(tier.tier());
            }
            return written;
        });
    }

    private Uni<Boolean> writeTier(ResponseCacheTier tier, CacheEntry entry) {
        return tier.put(entry)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Error writing key {0} to {1} tier: {2}", entry.key(), tier.tier(), error.getMessage());
                    return false;
                })
                .invoke(accepted -> {
                    if (!accepted) {
                        LOG.warnv("Failed to cache key {0} in {1} tier", entry.key(), tier.tier());
                        metrics.recordCacheWriteFailure(tier.tier());
                    }
                });
    }

    private Uni<Void> invalidateTier(ResponseCacheTier tier, String key) {
        if (tier == null) {
            return Uni.createFrom().voidItem();
        }
        return tier.invalidate(key).onFailure().recoverWithItem(error -> {
            LOG.warnv("Error invalidating key {0} in {1} tier: {2}", key, tier.tier(), error.getMessage());
            return null;
        });
    }
}
