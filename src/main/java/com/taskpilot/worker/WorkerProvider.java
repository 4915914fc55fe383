package com.taskpilot.worker;

import java.io.IOException;

/**
 * Starts worker processes.
 * Implementations: {@link LocalProcessWorkerProvider} (host processes).
 */
public interface WorkerProvider {

    /**
     * Starts the worker described by {@code request}.
     *
     * @throws IOException when the process cannot be started or its log cannot be opened
     */
    WorkerHandle launch(WorkerRequest request) throws IOException;
}
