package tollgate.adapter.out.quota;

import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import tollgate.adapter.out.quota.memory.InMemoryQuotaLimiterProvider;
import tollgate.adapter.out.quota.redis.RedisQuotaLimiterProvider;
import tollgate.core.config.QuotaConfig;
import tollgate.core.config.ResiliencyConfig;
import tollgate.core.model.quota.QuotaPolicy;
import tollgate.core.port.out.AccessMetrics;
import tollgate.core.port.out.QuotaLimiter;
import tollgate.spi.QuotaLimiterProvider;

/**
 * CDI producer for the quota limiter.
 *
 * <p>Selects the quota limiter implementation based on configuration and availability:
 * <ul>
 *   <li>Redis (priority 10) - Used when Redis is configured and a client is available</li>
 *   <li>In-memory (priority 0) - Fallback, always available</li>
 * </ul>
 *
 * <p>The Redis limiter handles Redis outages itself by metering locally, so a Redis
 * server that is down at startup does not make this loader pick the in-memory limiter.
 */
@ApplicationScoped
public class QuotaLimiterProviderLoader {

    private static final Logger LOG = Logger.getLogger(QuotaLimiterProviderLoader.class);

    private final QuotaConfig config;
    private final ResiliencyConfig resiliencyConfig;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final AccessMetrics metrics;

    @Inject
    public QuotaLimiterProviderLoader(
            QuotaConfig config,
            ResiliencyConfig resiliencyConfig,
            Instance<ReactiveRedisDataSource> redisDataSource,
            AccessMetrics metrics) {
        this.config = config;
        this.resiliencyConfig = resiliencyConfig;
        this.redisDataSource = redisDataSource;
        this.metrics = metrics;
    }

    /**
     * Produces the quota limiter instance for CDI injection.
     *
     * @return the selected quota limiter
     */
    @Produces
    @ApplicationScoped
    public QuotaLimiter produceQuotaLimiter() {
        final var policy = QuotaPolicy.of(config.callsPerWindow(), config.window());
        final var provider = selectProvider(policy);
        LOG.infov(
                "Using quota limiter provider: {0} (capacity={1}, refill={2}/s)",
                provider.name(), policy.capacity(), policy.refillRatePerSecond());
        return provider.createQuotaLimiter();
    }

    QuotaLimiterProvider selectProvider(QuotaPolicy policy) {
        return Stream.of(createRedisProvider(policy), Optional.of(createInMemoryProvider(policy)))
                .flatMap(Optional::stream)
                .filter(QuotaLimiterProvider::isAvailable)
                .max(Comparator.comparingInt(QuotaLimiterProvider::priority))
                .orElseThrow();
    }

    private Optional<QuotaLimiterProvider> createRedisProvider(QuotaPolicy policy) {
        if (!config.redis().enabled()) {
            LOG.debug("Redis quota limiting not enabled in configuration");
            return Optional.empty();
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis quota limiting enabled but ReactiveRedisDataSource not available");
            return Optional.empty();
        }

        try {
            return Optional.of(new RedisQuotaLimiterProvider(
                    redisDataSource.get(),
                    policy,
                    config.redis().key(),
                    config.redis().keyTtl(),
                    resiliencyConfig.redis().operationTimeout(),
                    metrics));
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize Redis quota limiter, falling back to in-memory");
            return Optional.empty();
        }
    }

    private QuotaLimiterProvider createInMemoryProvider(QuotaPolicy policy) {
        return new InMemoryQuotaLimiterProvider(policy);
    }
}
