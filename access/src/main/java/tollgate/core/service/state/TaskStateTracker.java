package tollgate.core.service.state;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.model.state.Diff;
import tollgate.core.model.state.OptimizationState;
import tollgate.core.model.state.ProposedChange;
import tollgate.core.port.out.ContentReader;
import tollgate.core.port.out.TaskStateRepository;

/**
 * Records the proposed-but-not-applied state of optimization tasks.
 *
 * <p>A task's state is created once at task start, filled with diffs and safety
 * check outcomes while the task runs, and read back by the review step. The review
 * step applies changes live only when {@link #readyToApply(String)} holds.
 */
@ApplicationScoped
public class TaskStateTracker {

    static final String TOOL_METADATA_KEY = "tool";

    private static final Logger LOG = Logger.getLogger(TaskStateTracker.class);

    private final TaskStateRepository repository;
    private final ContentReader contentReader;

    @Inject
    public TaskStateTracker(TaskStateRepository repository, ContentReader contentReader) {
        this.repository = repository;
        this.contentReader = contentReader;
    }

    /**
     * Create and persist the empty state of a task.
     *
     * <p>An existing record for the same task is overwritten; callers own idempotency.
     *
     * @param taskId the task identifier
     * @param dryRun whether the task only records changes
     * @return the new state, also returned when persisting it failed
     */
    public Uni<OptimizationState> createState(String taskId, boolean dryRun) {
        final var state = OptimizationState.initial(taskId, dryRun);
        return repository.save(state).map(saved -> {
            if (saved) {
                LOG.debugf("Created state for task %s (dryRun=%s)", taskId, dryRun);
            } else {
                LOG.errorv("Failed to persist initial state for task {0}", taskId);
            }
            return state;
        });
    }

    /**
     * Read the state of a task.
     *
     * @param taskId the task identifier
     * @return the state, or empty if not found
     */
    public Uni<Optional<OptimizationState>> getState(String taskId) {
        return repository.findById(taskId);
    }

    /**
     * Replace the proposed diffs of a task.
     *
     * @param taskId the task identifier
     * @param diffs the diffs, in order
     * @return true if the task exists and was updated
     */
    public Uni<Boolean> updateDiffs(String taskId, List<Diff> diffs) {
        return repository.replaceDiffs(taskId, diffs).invoke(updated -> {
            if (!updated) {
                LOG.errorv("State not found for task {0}, diffs not recorded", taskId);
            }
        });
    }

    /**
     * Record the outcome of one safety check.
     *
     * @param taskId the task identifier
     * @param checkName the check name
     * @param passed whether the check passed
     * @return true if the task exists and was updated
     */
    public Uni<Boolean> updateSafetyCheck(String taskId, String checkName, boolean passed) {
        return repository.recordSafetyCheck(taskId, checkName, passed).invoke(updated -> {
            if (!updated) {
                LOG.errorv("State not found for task {0}, safety check {1} not recorded", taskId, checkName);
            }
        });
    }

    /**
     * Pair a proposed change with the content currently at its address.
     *
     * <p>Only reads; nothing is persisted. A missing or unreadable resource yields an
     * empty original.
     *
     * @param change the proposed change
     * @return the diff
     */
    public Uni<Diff> generateDiff(ProposedChange change) {
        return contentReader
                .read(change.path())
                .map(original -> new Diff(
                        change.path(),
                        original.orElse(""),
                        change.proposedContent(),
                        Map.of(TOOL_METADATA_KEY, change.toolName())));
    }

    /**
     * Check whether the recorded safety checks allow applying a task's diffs live.
     *
     * @param taskId the task identifier
     * @return true if the task exists, at least one check ran, and all checks passed
     */
    public Uni<Boolean> readyToApply(String taskId) {
        return repository.findById(taskId).map(state -> {
            if (state.isEmpty()) {
                LOG.warnv("State not found for task {0}, refusing to apply", taskId);
                return false;
            }
            return state.get().allSafetyChecksPassed();
        });
    }
}
