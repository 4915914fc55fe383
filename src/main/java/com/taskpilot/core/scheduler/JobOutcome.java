package com.taskpilot.core.scheduler;

import com.taskpilot.core.persistence.JobResult;

import java.nio.file.Path;

/**
 * Final summary of a dispatch job.
 */
public record JobOutcome(
    String jobId,
    JobResult result,
    int totalTasks,
    int completed,
    int blocked,
    Path stateFile,
    String runId
) {

    public static final int EXIT_BLOCKERS = 2;

    /** 0 when every task finished, {@value #EXIT_BLOCKERS} when blockers remain. */
    public int exitCode() {
        return result == JobResult.COMPLETED_WITH_BLOCKERS ? EXIT_BLOCKERS : 0;
    }
}
