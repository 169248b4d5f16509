package tollgate.adapter.out.cache;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import tollgate.adapter.out.cache.disk.DiskResponseCache;
import tollgate.adapter.out.cache.redis.RedisResponseCache;
import tollgate.adapter.out.redis.RedisTimeoutHelper;
import tollgate.core.cache.CaffeineLocalCache;
import tollgate.core.config.CacheConfig;
import tollgate.core.config.ResiliencyConfig;
import tollgate.core.model.cache.CacheEntry;
import tollgate.core.port.out.AccessMetrics;
import tollgate.core.port.out.ResponseCacheTier;
import tollgate.core.service.cache.TieredResponseCache;

/**
 * CDI producer for the tiered response cache.
 *
 * <p>The memory tier is always present. The Redis tier is added when enabled and a
 * Redis client is configured; the disk tier when enabled and its directory can be
 * created. A tier that cannot be built is left out and the cache runs with the rest.
 */
@ApplicationScoped
public class ResponseCacheProducer {

    private static final Logger LOG = Logger.getLogger(ResponseCacheProducer.class);

    private final CacheConfig config;
    private final ResiliencyConfig resiliencyConfig;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final AccessMetrics metrics;

    @Inject
    public ResponseCacheProducer(
            CacheConfig config,
            ResiliencyConfig resiliencyConfig,
            Instance<ReactiveRedisDataSource> redisDataSource,
            AccessMetrics metrics) {
        this.config = config;
        this.resiliencyConfig = resiliencyConfig;
        this.redisDataSource = redisDataSource;
        this.metrics = metrics;
    }

    /**
     * Produces the process-wide response cache.
     *
     * @return the tiered cache
     */
    @Produces
    @ApplicationScoped
    public TieredResponseCache responseCache() {
        final var memory = config.memory();
        final var memoryCache = new CaffeineLocalCache<String, CacheEntry>(
                memory.ttl(), memory.maxEntries(), memory.jitterFactor());

        final var cache = new TieredResponseCache(
                memoryCache,
                createSharedTier().orElse(null),
                createDiskTier().orElse(null),
                metrics,
                Clock.systemUTC());
        LOG.infov("Response cache tiers: {0}", cache.activeTiers());
        return cache;
    }

    private Optional<ResponseCacheTier> createSharedTier() {
        final var shared = config.shared();
        if (!shared.enabled()) {
            LOG.debug("Redis cache tier not enabled in configuration");
            return Optional.empty();
        }
        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis cache tier enabled but ReactiveRedisDataSource not available");
            return Optional.empty();
        }

        try {
            final var timeoutHelper = new RedisTimeoutHelper(
                    resiliencyConfig.redis().operationTimeout(), metrics, "RedisResponseCache");
            return Optional.of(new RedisResponseCache(
                    redisDataSource.get(), shared.keyPrefix(), shared.ttl(), timeoutHelper, Clock.systemUTC()));
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize Redis cache tier, continuing without it");
            return Optional.empty();
        }
    }

    private Optional<ResponseCacheTier> createDiskTier() {
        final var disk = config.disk();
        if (!disk.enabled()) {
            LOG.debug("Disk cache tier not enabled in configuration");
            return Optional.empty();
        }

        try {
            return Optional.of(new DiskResponseCache(Path.of(disk.directory()), disk.ttl(), Clock.systemUTC()));
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize disk cache tier at {0}, continuing without it", disk.directory());
            return Optional.empty();
        }
    }
}
