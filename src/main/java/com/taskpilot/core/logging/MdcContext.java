package com.taskpilot.core.logging;

import org.slf4j.MDC;

/**
 * Manages the MDC keys the logback pattern prints: jobId, taskId and attempt.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(String jobId) {
        MDC.put("jobId", jobId);
    }

    public static void setTask(String jobId, String taskId, int attempt) {
        MDC.put("jobId", jobId);
        MDC.put("taskId", taskId);
        MDC.put("attempt", String.valueOf(attempt));
    }

    /** Drops task-level keys, keeping the job. */
    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("attempt");
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("taskId");
        MDC.remove("attempt");
    }
}
