package com.taskpilot.core.scheduler;

import com.taskpilot.core.model.Task;
import com.taskpilot.worker.WorkerHandle;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Starts the worker process for one attempt. The loop does not know how prompts, working
 * directories or environments are assembled.
 */
public interface WorkerLauncher {

    WorkerHandle launch(Task task, int attempt, int completedTasks) throws IOException;

    /** Log file the attempt writes to, known before the process starts. */
    Path logPath(Task task, int attempt);
}
