package tollgate.adapter.out.telemetry;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import tollgate.core.config.MetricsConfig;
import tollgate.core.model.cache.CacheTier;
import tollgate.core.model.quota.QuotaSource;
import tollgate.core.port.out.AccessMetrics;

/**
 * Records access-layer metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tollgate.cache.hits.total} - Cache hits by tier</li>
 *   <li>{@code tollgate.cache.misses.total} - Lookups that missed every tier</li>
 *   <li>{@code tollgate.cache.write.failures.total} - Rejected tier writes by tier</li>
 *   <li>{@code tollgate.quota.decisions.total} - Quota decisions by outcome and source</li>
 *   <li>{@code tollgate.quota.wait} - Time callers were slowed near the quota</li>
 *   <li>{@code tollgate.degradations.total} - Components falling back to local mode</li>
 *   <li>{@code tollgate.redis.timeouts.total} - Redis operation timeouts</li>
 *   <li>{@code tollgate.redis.failures.total} - Redis operation failures</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAccessMetrics implements AccessMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerAccessMetrics(MeterRegistry registry, MetricsConfig config) {
        this(registry, config != null && config.enabled());
    }

    public MicrometerAccessMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    // -------------------------------------------------------------------------
    // Cache Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordCacheHit(CacheTier tier) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.cache.hits.total")
                .description("Cache lookups served by a tier")
                .tag("tier", tierTag(tier))
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheMiss() {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.cache.misses.total")
                .description("Cache lookups that missed every tier")
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheWriteFailure(CacheTier tier) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.cache.write.failures.total")
                .description("Cache writes rejected by a tier")
                .tag("tier", tierTag(tier))
                .register(registry)
                .increment();
    }

    // -------------------------------------------------------------------------
    // Quota Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordQuotaDecision(boolean granted, QuotaSource source) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.quota.decisions.total")
                .description("Quota decisions by outcome")
                .tag("outcome", granted ? "granted" : "denied")
                .tag("source", source.name().toLowerCase())
                .register(registry)
                .increment();
    }

    @Override
    public void recordQuotaWait(Duration waited) {
        if (!enabled) {
            return;
        }

        Timer.builder("tollgate.quota.wait")
                .description("Time callers were delayed because the quota ran low")
                .register(registry)
                .record(waited);
    }

    // -------------------------------------------------------------------------
    // Degradation Metrics
    // -------------------------------------------------------------------------

    @Override
    public void recordDegradation(String component) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.degradations.total")
                .description("Components falling back from the shared store to local mode")
                .tag("component", component)
                .register(registry)
                .increment();
    }

    @Override
    public void recordRedisTimeout(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.redis.timeouts.total")
                .description("Redis operations that timed out")
                .tag("repository", repository)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordRedisFailure(String repository, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("tollgate.redis.failures.total")
                .description("Redis operations that failed")
                .tag("repository", repository)
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    private String tierTag(CacheTier tier) {
        return tier.name().toLowerCase();
    }
}
