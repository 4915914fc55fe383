package com.taskpilot.worker;

import java.nio.file.Path;

/**
 * Per-job facts every worker launch needs.
 *
 * @param jobId         dispatch job id
 * @param scopeId       initiative whose backlog is dispatched
 * @param correlationId correlation id forwarded to workers
 * @param planPath      plan file path as given, null when no plan was supplied
 * @param planText      plan contents, empty when no plan was supplied
 * @param jobConfig     per-job overrides
 * @param jobLogsDir    directory holding this job's worker logs and state
 * @param totalTasks    queue size, used for the progress snapshot in prompts
 */
public record JobContext(
    String jobId,
    String scopeId,
    String correlationId,
    String planPath,
    String planText,
    JobConfig jobConfig,
    Path jobLogsDir,
    int totalTasks
) {

    public JobContext {
        planText = planText == null ? "" : planText;
        jobConfig = jobConfig == null ? JobConfig.empty() : jobConfig;
    }

    public Path logPath(String taskId, int attempt) {
        String safeId = taskId.replaceAll("[^A-Za-z0-9._-]", "_");
        return jobLogsDir.resolve(safeId + "-attempt-" + attempt + ".log");
    }
}
