package tollgate.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.cache.CacheEntry;
import tollgate.core.model.cache.CacheTier;

/**
 * Port interface for one slower tier of the response cache (shared store or disk).
 *
 * <p>Tiers are best-effort: implementations absorb their own backing-store failures,
 * reporting them as misses or failed writes instead of failing the returned {@link Uni}.
 */
public interface ResponseCacheTier {

    /**
     * Returns which tier this is.
     *
     * @return the tier
     */
    CacheTier tier();

    /**
     * Returns the time-to-live applied to entries in this tier.
     *
     * @return the TTL
     */
    Duration ttl();

    /**
     * Look up an entry.
     *
     * @param key the cache key
     * @return the entry if present and not older than {@link #ttl()}, otherwise empty
     */
    Uni<Optional<CacheEntry>> get(String key);

    /**
     * Store an entry, replacing any previous entry for the same key.
     *
     * @param entry the entry to store
     * @return true if the tier accepted the write
     */
    Uni<Boolean> put(CacheEntry entry);

    /**
     * Remove an entry.
     *
     * @param key the cache key
     * @return completion signal
     */
    Uni<Void> invalidate(String key);
}
