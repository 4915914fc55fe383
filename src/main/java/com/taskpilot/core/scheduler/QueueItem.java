package com.taskpilot.core.scheduler;

import com.taskpilot.core.model.Task;

import java.time.Instant;

/**
 * A task waiting in the dispatch queue. Retries re-enter with a future {@code availableAt}.
 */
public record QueueItem(Task task, Instant availableAt) {

    public boolean isEligible(Instant now) {
        return availableAt == null || !availableAt.isAfter(now);
    }
}
