package tollgate.adapter.out.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.port.out.AccessMetrics;

/**
 * Helper for applying timeouts and failure handling to Redis operations with graceful degradation.
 *
 * <p>Every component backed by Redis must degrade rather than hang or crash when the store
 * is slow or unreachable. This helper bounds each operation with a timeout and turns both
 * timeouts and failures (connection errors, server errors, etc.) into a fallback result.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeoutGraceful} - Fail-soft: returns empty Optional on timeout or any failure.
 *       Use for reads where missing data is acceptable.</li>
 *   <li>{@link #withTimeoutFallback} - Fail-over: returns a custom fallback on timeout or any failure.
 *       Use for the quota bucket, which falls back to local metering.</li>
 *   <li>{@link #withTimeoutSilent} - Fire-and-forget: logs but ignores timeout or any failure.
 *       Use for cache invalidation.</li>
 * </ul>
 *
 * <h2>Metrics</h2>
 * Records separate metrics for timeouts ({@code tollgate.redis.timeouts.total}) and
 * non-timeout failures ({@code tollgate.redis.failures.total}).
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final AccessMetrics metrics;
    private final String repositoryName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance for recording timeouts (may be null)
     * @param repositoryName the component name for logs and metric tags
     */
    public RedisTimeoutHelper(Duration timeout, AccessMetrics metrics, String repositoryName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.repositoryName = repositoryName;
    }

    /**
     * Apply timeout with graceful degradation to empty Optional.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that returns empty Optional on timeout or failure
     */
    public <T> Uni<Optional<T>> withTimeoutGraceful(Uni<T> operation, String operationName) {
        return operation
                .map(Optional::ofNullable)
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (graceful): {0} in {1} after {2}",
                            operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return Optional.empty();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis operation failure (graceful): {0} in {1}: {2}",
                            operationName, repositoryName, error.getMessage());
                    recordFailure(operationName);
                    return Optional.empty();
                });
    }

    /**
     * Apply timeout with graceful degradation to custom fallback.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param fallback supplier for fallback value on timeout or failure
     * @param <T> the result type
     * @return a Uni that returns fallback value on timeout or failure
     */
    public <T> Uni<T> withTimeoutFallback(Uni<T> operation, String operationName, Supplier<T> fallback) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (fallback): {0} in {1} after {2}",
                            operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return fallback.get();
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis operation failure (fallback): {0} in {1}: {2}",
                            operationName, repositoryName, error.getMessage());
                    recordFailure(operationName);
                    return fallback.get();
                });
    }

    /**
     * Apply timeout with silent failure (fire-and-forget operations).
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @return a Uni that completes with void on timeout or failure
     */
    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Redis operation timeout (silent): {0} in {1} after {2}",
                            operationName, repositoryName, timeout);
                    recordTimeout(operationName);
                    return null;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Redis operation failure (silent): {0} in {1}: {2}",
                            operationName, repositoryName, error.getMessage());
                    recordFailure(operationName);
                    return null;
                });
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordRedisTimeout(repositoryName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordRedisFailure(repositoryName, operationName);
        }
    }
}
