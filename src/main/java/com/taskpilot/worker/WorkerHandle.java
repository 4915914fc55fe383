package com.taskpilot.worker;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * A started worker process.
 */
public interface WorkerHandle {

    long pid();

    Path logPath();

    boolean isAlive();

    /** Asks the process to stop (SIGTERM on POSIX). */
    void terminate();

    /** Kills the process and its descendants (SIGKILL on POSIX). */
    void kill();

    /**
     * Completes with the exit code once the process has exited. Completion runs on a
     * JDK process-reaper thread.
     */
    CompletableFuture<Integer> onExit();
}
