package com.taskpilot.worker;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to start one worker process.
 *
 * @param taskId      the task this worker serves
 * @param attempt     1-based attempt number
 * @param summary     "title (id)", written into the log start marker
 * @param command     executable followed by its arguments, prompt last
 * @param workingDir  process working directory
 * @param environment variables added to the inherited environment
 * @param logFile     file receiving stdout and stderr (appended)
 */
public record WorkerRequest(
    String taskId,
    int attempt,
    String summary,
    List<String> command,
    Path workingDir,
    Map<String, String> environment,
    Path logFile
) {}
