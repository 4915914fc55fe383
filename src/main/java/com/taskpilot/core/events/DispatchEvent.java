package com.taskpilot.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An in-process event emitted by the dispatch loop, consumed by the CLI for live output.
 *
 * @param eventType e.g. "job.started", "task.dispatched", "task.blocked", "job.heartbeat"
 * @param jobId     the dispatch job this event belongs to
 * @param taskId    the task this event relates to (nullable for job-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record DispatchEvent(
    String eventType,
    String jobId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String JOB_STARTED = "job.started";
    public static final String JOB_HEARTBEAT = "job.heartbeat";
    public static final String JOB_THROTTLED = "job.throttled";
    public static final String JOB_COMPLETED = "job.completed";
    public static final String JOB_FAILED = "job.failed";
    public static final String TASK_DISPATCHED = "task.dispatched";
    public static final String TASK_SUCCEEDED = "task.succeeded";
    public static final String TASK_RETRY_SCHEDULED = "task.retry_scheduled";
    public static final String TASK_BLOCKED = "task.blocked";
    public static final String WORKER_KILLED = "worker.killed";
}
