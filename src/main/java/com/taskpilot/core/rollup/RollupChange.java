package com.taskpilot.core.rollup;

/**
 * A rollup transition awaiting propagation.
 *
 * @param entityId      milestone or workstream id
 * @param entityName    display name, falls back to the id
 * @param previous      last propagated rollup
 * @param current       freshly computed rollup
 * @param triggerTaskId task whose transition caused the recompute
 * @param attempt       attempt number of the triggering task
 */
public record RollupChange(
    String entityId,
    String entityName,
    Rollup previous,
    Rollup current,
    String triggerTaskId,
    int attempt
) {

    public RollupLevel level() {
        return current.level();
    }

    public boolean statusChanged() {
        return previous == null || !previous.status().equals(current.status());
    }
}
