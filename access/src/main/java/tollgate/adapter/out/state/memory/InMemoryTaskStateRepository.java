package tollgate.adapter.out.state.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.model.state.Diff;
import tollgate.core.model.state.OptimizationState;
import tollgate.core.port.out.TaskStateRepository;

/**
 * In-memory implementation of TaskStateRepository.
 *
 * <p>This implementation is intended for single-process deployments and testing.
 * State is lost on restart and not shared across processes.
 *
 * <p>Updates go through {@link ConcurrentMap#computeIfPresent}, so two updates to the
 * same task are applied one after the other and neither is lost. Records expire after
 * the retention period, counted from their last write; expired records are hidden on
 * read and removed by a periodic sweep.
 */
public class InMemoryTaskStateRepository implements TaskStateRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryTaskStateRepository.class);

    private record StoredState(OptimizationState state, Instant expiresAt) {}

    private final ConcurrentMap<String, StoredState> states = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryTaskStateRepository(Duration retention) {
        this(retention, Clock.systemUTC());
    }

    public InMemoryTaskStateRepository(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            final var t = new Thread(r, "task-state-cleanup");
            t.setDaemon(true);
            return t;
        });

        // Run cleanup every minute
        cleanupExecutor.scheduleAtFixedRate(this::purgeExpired, 1, 1, TimeUnit.MINUTES);
    }

    @Override
    public Uni<Boolean> save(OptimizationState state) {
        return Uni.createFrom().item(() -> {
            states.put(state.taskId(), stored(state));
            return true;
        });
    }

    @Override
    public Uni<Optional<OptimizationState>> findById(String taskId) {
        return Uni.createFrom().item(() -> {
            final var stored = states.get(taskId);
            if (stored == null || isExpired(stored)) {
                return Optional.empty();
            }
            return Optional.of(stored.state());
        });
    }

    @Override
    public Uni<Boolean> replaceDiffs(String taskId, List<Diff> diffs) {
        return Uni.createFrom().item(() -> update(taskId, state -> state.withDiffs(diffs)));
    }

    @Override
    public Uni<Boolean> recordSafetyCheck(String taskId, String checkName, boolean passed) {
        return Uni.createFrom().item(() -> update(taskId, state -> state.withSafetyCheck(checkName, passed)));
    }

    /**
     * Remove every expired record.
     *
     * @return the number of records removed
     */
    public int purgeExpired() {
        var removed = 0;
        for (final var entry : states.entrySet()) {
            if (isExpired(entry.getValue()) && states.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired task states", removed);
        }
        return removed;
    }

    /**
     * Shuts down the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Return the number of stored records, expired ones included (for testing).
     */
    int size() {
        return states.size();
    }

    private boolean update(String taskId, UnaryOperator<OptimizationState> change) {
        final var updated = states.computeIfPresent(
                taskId, (id, stored) -> isExpired(stored) ? null : stored(change.apply(stored.state())));
        return updated != null;
    }

    private StoredState stored(OptimizationState state) {
        return new StoredState(state, clock.instant().plus(retention));
    }

    private boolean isExpired(StoredState stored) {
        return !clock.instant().isBefore(stored.expiresAt());
    }
}
