package tollgate.core.model.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A cached response payload.
 *
 * <p>The write time drives expiry: each tier compares it against its own TTL, so an
 * entry can be fresh in one tier and expired in another.
 *
 * @param key the caller-chosen cache key
 * @param value the opaque JSON payload
 * @param writtenAt when the entry was written to the tier holding it
 */
public record CacheEntry(String key, JsonNode value, Instant writtenAt) {

    public CacheEntry {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(writtenAt, "writtenAt cannot be null");
    }

    /**
     * Returns whether this entry is older than the given TTL at the given instant.
     *
     * @param ttl the tier time-to-live
     * @param now the current instant
     * @return true if the entry must be treated as absent
     */
    public boolean isExpired(Duration ttl, Instant now) {
        return writtenAt.plus(ttl).isBefore(now);
    }

    /**
     * Returns a copy of this entry stamped with a new write time, used when promoting
     * a hit from a slower tier into a faster one.
     *
     * @param now the new write time
     * @return the restamped entry
     */
    public CacheEntry restamp(Instant now) {
        return new CacheEntry(key, value, now);
    }
}
