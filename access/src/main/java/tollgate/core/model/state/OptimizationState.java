package tollgate.core.model.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Proposed-but-not-applied state of one optimization task.
 *
 * <p>Instances are immutable snapshots. The task state tracker owns the persisted
 * record; a snapshot returned by a read may be stale once another caller updates the
 * same task.
 *
 * @param taskId the task identifier
 * @param dryRun whether the task only records changes without applying them
 * @param diffs the proposed changes, in order
 * @param safetyChecks safety check outcomes by check name
 */
public record OptimizationState(
        String taskId, boolean dryRun, List<Diff> diffs, Map<String, Boolean> safetyChecks) {

    public OptimizationState {
        Objects.requireNonNull(taskId, "taskId cannot be null");
        if (taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be blank");
        }
        diffs = diffs != null ? List.copyOf(diffs) : List.of();
        safetyChecks = safetyChecks != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(safetyChecks))
                : Map.of();
    }

    /**
     * Creates the initial state of a task: no diffs and no safety checks.
     *
     * @param taskId the task identifier
     * @param dryRun whether the task is a dry run
     * @return the empty state
     */
    public static OptimizationState initial(String taskId, boolean dryRun) {
        return new OptimizationState(taskId, dryRun, List.of(), Map.of());
    }

    /**
     * Returns a copy with the diff list replaced.
     *
     * @param newDiffs the new diffs
     * @return the updated state
     */
    public OptimizationState withDiffs(List<Diff> newDiffs) {
        return new OptimizationState(taskId, dryRun, newDiffs, safetyChecks);
    }

    /**
     * Returns a copy with one safety check outcome set.
     *
     * @param checkName the check name
     * @param passed whether the check passed
     * @return the updated state
     */
    public OptimizationState withSafetyCheck(String checkName, boolean passed) {
        final var checks = new LinkedHashMap<>(safetyChecks);
        checks.put(checkName, passed);
        return new OptimizationState(taskId, dryRun, diffs, checks);
    }

    /**
     * Returns whether at least one safety check ran and all of them passed.
     *
     * @return true if the recorded checks allow applying the diffs
     */
    public boolean allSafetyChecksPassed() {
        return !safetyChecks.isEmpty() && safetyChecks.values().stream().allMatch(Boolean::booleanValue);
    }
}
