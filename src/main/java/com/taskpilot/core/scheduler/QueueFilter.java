package com.taskpilot.core.scheduler;

import java.util.Set;

/**
 * Selection applied when building the dispatch queue.
 *
 * @param workstreamIds restrict to these workstreams; empty means all
 * @param taskIds       restrict to these tasks; empty means all. Explicitly selected tasks
 *                      are kept even when already done
 * @param includeDone   keep done-classified tasks
 * @param maxTasks      cap on queue length after ordering; 0 or less means unbounded
 */
public record QueueFilter(Set<String> workstreamIds, Set<String> taskIds, boolean includeDone, int maxTasks) {

    public QueueFilter {
        workstreamIds = workstreamIds == null ? Set.of() : Set.copyOf(workstreamIds);
        taskIds = taskIds == null ? Set.of() : Set.copyOf(taskIds);
    }

    public static QueueFilter all() {
        return new QueueFilter(Set.of(), Set.of(), false, 0);
    }
}
