package tollgate.adapter.out.state;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import tollgate.adapter.out.redis.RedisReachability;
import tollgate.adapter.out.redis.RedisTimeoutHelper;
import tollgate.adapter.out.state.memory.InMemoryTaskStateRepository;
import tollgate.adapter.out.state.redis.RedisTaskStateRepository;
import tollgate.core.config.ResiliencyConfig;
import tollgate.core.config.TaskStateConfig;
import tollgate.core.port.out.AccessMetrics;
import tollgate.core.port.out.TaskStateRepository;

/**
 * CDI producer for the task state repository.
 *
 * <p>The backend is chosen once, at construction: Redis when it is enabled, a client
 * is configured, and the server answers a PING; otherwise the in-memory repository.
 * The in-memory repository only works for a single process, so falling back to it is
 * logged as a degradation.
 */
@ApplicationScoped
public class TaskStateRepositoryProducer {

    private static final Logger LOG = Logger.getLogger(TaskStateRepositoryProducer.class);

    private final TaskStateConfig config;
    private final ResiliencyConfig resiliencyConfig;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final AccessMetrics metrics;

    @Inject
    public TaskStateRepositoryProducer(
            TaskStateConfig config,
            ResiliencyConfig resiliencyConfig,
            Instance<ReactiveRedisDataSource> redisDataSource,
            AccessMetrics metrics) {
        this.config = config;
        this.resiliencyConfig = resiliencyConfig;
        this.redisDataSource = redisDataSource;
        this.metrics = metrics;
    }

    /**
     * Produces the task state repository for CDI injection.
     *
     * @return the selected repository
     */
    @Produces
    @ApplicationScoped
    public TaskStateRepository taskStateRepository() {
        final var redis = createRedisRepository();
        if (redis.isPresent()) {
            LOG.infov("Using Redis task state repository (prefix={0})", config.redis().keyPrefix());
            return redis.get();
        }

        if (config.redis().enabled()) {
            LOG.warn("Redis unavailable for task state, using in-memory repository (single process only)");
            metrics.recordDegradation("state");
        } else {
            LOG.info("Using in-memory task state repository");
        }
        return new InMemoryTaskStateRepository(config.retention());
    }

    /**
     * Disposes the repository, shutting down any cleanup executors.
     */
    void disposeTaskStateRepository(@Disposes TaskStateRepository repository) {
        if (repository instanceof InMemoryTaskStateRepository inMemory) {
            inMemory.shutdown();
        }
    }

    private Optional<TaskStateRepository> createRedisRepository() {
        if (!config.redis().enabled()) {
            LOG.debug("Redis task state not enabled in configuration");
            return Optional.empty();
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis task state enabled but ReactiveRedisDataSource not available");
            return Optional.empty();
        }

        try {
            final var ds = redisDataSource.get();
            if (!RedisReachability.ping(ds, resiliencyConfig.redis().probeTimeout())) {
                return Optional.empty();
            }
            final var timeoutHelper = new RedisTimeoutHelper(
                    resiliencyConfig.redis().operationTimeout(), metrics, "RedisTaskStateRepository");
            return Optional.of(
                    new RedisTaskStateRepository(ds, config.redis().keyPrefix(), config.retention(), timeoutHelper));
        } catch (Exception e) {
            LOG.warnv(e, "Failed to initialize Redis task state repository, falling back to in-memory");
            return Optional.empty();
        }
    }
}
