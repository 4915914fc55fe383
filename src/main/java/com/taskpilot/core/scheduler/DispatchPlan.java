package com.taskpilot.core.scheduler;

import com.taskpilot.core.model.Task;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What the loop starts from: the tasks to dispatch, in order, plus whatever a resumed job
 * already settled.
 *
 * @param queue          tasks to dispatch, already ordered
 * @param priorAttempts  attempts already consumed per task id
 * @param skippedDone    ids skipped because a prior run finished them
 * @param skippedBlocked ids skipped because a prior run blocked them; they still count as blockers
 * @param totalTasks     size of the full queue before resume skips
 */
public record DispatchPlan(
    List<Task> queue,
    Map<String, Integer> priorAttempts,
    Set<String> skippedDone,
    Set<String> skippedBlocked,
    int totalTasks
) {

    public DispatchPlan {
        queue = List.copyOf(queue);
        priorAttempts = Map.copyOf(priorAttempts);
        skippedDone = Set.copyOf(skippedDone);
        skippedBlocked = Set.copyOf(skippedBlocked);
    }

    public static DispatchPlan fresh(List<Task> queue) {
        return new DispatchPlan(queue, Map.of(), Set.of(), Set.of(), queue.size());
    }
}
