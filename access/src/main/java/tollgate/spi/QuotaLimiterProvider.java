package tollgate.spi;

import tollgate.core.port.out.QuotaLimiter;

/**
 * Service Provider Interface for quota limiter implementations.
 *
 * <p>Providers are selected based on priority and availability. Higher priority
 * providers are preferred.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>In-memory (priority 0) - Default, meters each process on its own</li>
 *   <li>Redis (priority 10) - One bucket shared by every process</li>
 * </ul>
 *
 * @see tollgate.core.port.out.QuotaLimiter
 */
public interface QuotaLimiterProvider {

    /**
     * Return the priority of this provider.
     *
     * <p>Higher values indicate higher priority.
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider for logging.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider is available in the current environment.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create a quota limiter instance.
     *
     * <p>Called once during application startup. The returned instance must be
     * thread-safe.
     *
     * @return the quota limiter instance
     */
    QuotaLimiter createQuotaLimiter();
}
