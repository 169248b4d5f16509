package tollgate.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.state.Diff;
import tollgate.core.model.state.OptimizationState;

/**
 * Port interface for persisting optimization task state.
 *
 * <p>Updates are field-level: replacing the diffs and recording a safety check each
 * touch only their own part of the record, atomically against the backing store, so
 * concurrent updates to different fields of the same task are never lost.
 *
 * <p>Write operations report backing-store failures as {@code false}; reads report
 * them, and records that cannot be decoded, as empty.
 */
public interface TaskStateRepository {

    /**
     * Store a complete state record, replacing any existing record for the task.
     *
     * @param state the state to store
     * @return true if the record was written
     */
    Uni<Boolean> save(OptimizationState state);

    /**
     * Find the state of a task.
     *
     * <p>The order of the returned safety checks depends on the backing store and is
     * not significant.
     *
     * @param taskId the task identifier
     * @return the state, or empty if absent, expired or unreadable
     */
    Uni<Optional<OptimizationState>> findById(String taskId);

    /**
     * Replace the diff list of an existing task.
     *
     * @param taskId the task identifier
     * @param diffs the new diffs, in order
     * @return true if the task exists and the diffs were written
     */
    Uni<Boolean> replaceDiffs(String taskId, List<Diff> diffs);

    /**
     * Record one safety check outcome on an existing task.
     *
     * @param taskId the task identifier
     * @param checkName the check name
     * @param passed whether the check passed
     * @return true if the task exists and the outcome was written
     */
    Uni<Boolean> recordSafetyCheck(String taskId, String checkName, boolean passed);
}
