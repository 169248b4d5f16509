package tollgate.adapter.in.health;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.arc.ClientProxy;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import tollgate.adapter.out.quota.redis.RedisQuotaLimiter;
import tollgate.adapter.out.state.redis.RedisTaskStateRepository;
import tollgate.core.config.CacheConfig;
import tollgate.core.config.ResiliencyConfig;
import tollgate.core.port.out.QuotaLimiter;
import tollgate.core.port.out.TaskStateRepository;
import tollgate.core.service.cache.TieredResponseCache;
import tollgate.core.service.quota.QuotaGuard;

/**
 * Readiness check for the access layer.
 *
 * <p>Reports which backends each component ended up with:
 * <ul>
 *   <li><b>Quota</b>: coordinated, degraded to local, or local only; plus the remaining estimate</li>
 *   <li><b>State</b>: Redis or in-memory</li>
 *   <li><b>Cache</b>: active tiers and the disk tier directory</li>
 * </ul>
 *
 * <p>This health check always reports UP. Every component keeps working in its local
 * mode when Redis is gone, so losing Redis degrades the process but does not make it
 * unready; degradation is alerted on through {@code tollgate.degradations.total}.
 */
@Readiness
@ApplicationScoped
public class AccessLayerHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(AccessLayerHealthCheck.class);

    private final TieredResponseCache cache;
    private final QuotaLimiter quotaLimiter;
    private final QuotaGuard quotaGuard;
    private final TaskStateRepository stateRepository;
    private final String diskDirectory;
    private final Duration probeTimeout;

    @Inject
    public AccessLayerHealthCheck(
            TieredResponseCache cache,
            QuotaLimiter quotaLimiter,
            QuotaGuard quotaGuard,
            TaskStateRepository stateRepository,
            CacheConfig cacheConfig,
            ResiliencyConfig resiliencyConfig) {
        this(
                cache,
                quotaLimiter,
                quotaGuard,
                stateRepository,
                cacheConfig.disk().enabled() ? cacheConfig.disk().directory() : "disabled",
                resiliencyConfig.redis().probeTimeout());
    }

    AccessLayerHealthCheck(
            TieredResponseCache cache,
            QuotaLimiter quotaLimiter,
            QuotaGuard quotaGuard,
            TaskStateRepository stateRepository,
            String diskDirectory,
            Duration probeTimeout) {
        this.cache = cache;
        // Produced beans arrive as client proxies; backend checks need the instance
        this.quotaLimiter = ClientProxy.unwrap(quotaLimiter);
        this.quotaGuard = quotaGuard;
        this.stateRepository = ClientProxy.unwrap(stateRepository);
        this.diskDirectory = diskDirectory;
        this.probeTimeout = probeTimeout;
    }

    @Override
    public HealthCheckResponse call() {
        final var builder = HealthCheckResponse.named("access-layer");
        builder.withData("quota.mode", quotaMode());
        builder.withData("quota.remaining", remainingEstimate());
        builder.withData("state.backend", stateRepository instanceof RedisTaskStateRepository ? "redis" : "memory");
        builder.withData("cache.tiers", cache.activeTiers().toString());
        builder.withData("cache.disk.directory", diskDirectory);

        // UP while any backend works; degradation is monitored via metrics
        return builder.up().build();
    }

    private String quotaMode() {
        if (quotaLimiter instanceof RedisQuotaLimiter redis) {
            return redis.isDegraded() ? "degraded" : "coordinated";
        }
        return "local";
    }

    private String remainingEstimate() {
        try {
            final var remaining = quotaGuard.remainingEstimate().await().atMost(probeTimeout);
            return String.valueOf(remaining);
        } catch (RuntimeException e) {
            LOG.warnv("Could not estimate remaining quota for health check: {0}", e.getMessage());
            return "unknown";
        }
    }
}
