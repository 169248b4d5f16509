package tollgate.core.port.out;

import java.time.Duration;

import tollgate.core.model.cache.CacheTier;
import tollgate.core.model.quota.QuotaSource;

/**
 * Port interface for recording access-layer metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface AccessMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a cache hit.
     *
     * @param tier the tier that served the hit
     */
    void recordCacheHit(CacheTier tier);

    /**
     * Record a lookup that missed every tier.
     */
    void recordCacheMiss();

    /**
     * Record a failed write to a cache tier.
     *
     * @param tier the tier that rejected the write
     */
    void recordCacheWriteFailure(CacheTier tier);

    /**
     * Record a quota decision.
     *
     * @param granted whether the call was granted
     * @param source which bucket decided
     */
    void recordQuotaDecision(boolean granted, QuotaSource source);

    /**
     * Record time spent smoothing a caller that ran close to the quota.
     *
     * @param waited the wait duration
     */
    void recordQuotaWait(Duration waited);

    /**
     * Record a component degrading to its fallback mode.
     *
     * @param component the component name (e.g. "quota", "state")
     */
    void recordDegradation(String component);

    /**
     * Record a Redis operation timeout.
     *
     * @param repository the component that issued the operation
     * @param operation the operation name
     */
    void recordRedisTimeout(String repository, String operation);

    /**
     * Record a Redis operation failure other than a timeout.
     *
     * @param repository the component that issued the operation
     * @param operation the operation name
     */
    void recordRedisFailure(String repository, String operation);
}
