package tollgate.support;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.cache.CacheEntry;
import tollgate.core.model.cache.CacheTier;
import tollgate.core.port.out.ResponseCacheTier;

/**
 * Map-backed cache tier that honours its TTL against a clock and can be switched to fail.
 */
public final class FakeCacheTier implements ResponseCacheTier {

    private final CacheTier tier;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private volatile boolean failing;

    public FakeCacheTier(CacheTier tier, Duration ttl, Clock clock) {
        this.tier = tier;
        this.ttl = ttl;
        this.clock = clock;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public Optional<CacheEntry> stored(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void store(CacheEntry entry) {
        entries.put(entry.key(), entry);
    }

    @Override
    public CacheTier tier() {
        return tier;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    public Uni<Optional<CacheEntry>> get(String key) {
        if (failing) {
            return Uni.createFrom().failure(new IllegalStateException(tier + " unavailable"));
        }
        final var entry = entries.get(key);
        if (entry == null || entry.isExpired(ttl, clock.instant())) {
            return Uni.createFrom().item(Optional.empty());
        }
        return Uni.createFrom().item(Optional.of(entry));
    }

    @Override
    public Uni<Boolean> put(CacheEntry entry) {
        if (failing) {
            return Uni.createFrom().failure(new IllegalStateException(tier + " unavailable"));
        }
        entries.put(entry.key(), entry);
        return Uni.createFrom().item(true);
    }

    @Override
    public Uni<Void> invalidate(String key) {
        if (failing) {
            return Uni.createFrom().failure(new IllegalStateException(tier + " unavailable"));
        }
        entries.remove(key);
        return Uni.createFrom().voidItem();
    }
}
