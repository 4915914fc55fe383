package com.taskpilot.worker;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Scriptable {@link WorkerHandle} for tests: records signals and exits when told to.
 */
public class FakeWorkerHandle implements WorkerHandle {

    private final long pid;
    private final Path logPath;
    private final CompletableFuture<Integer> exit = new CompletableFuture<>();
    private boolean alive = true;
    private int terminateCalls;
    private int killCalls;
    private boolean ignoreTerminate;

    public FakeWorkerHandle(long pid, Path logPath) {
        this.pid = pid;
        this.logPath = logPath;
    }

    /** A handle whose process has already exited with {@code exitCode}. */
    public static FakeWorkerHandle exited(long pid, Path logPath, int exitCode) {
        FakeWorkerHandle handle = new FakeWorkerHandle(pid, logPath);
        handle.exit(exitCode);
        return handle;
    }

    public FakeWorkerHandle ignoringTerminate() {
        this.ignoreTerminate = true;
        return this;
    }

    public void exit(int exitCode) {
        alive = false;
        exit.complete(exitCode);
    }

    @Override
    public long pid() {
        return pid;
    }

    @Override
    public Path logPath() {
        return logPath;
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public void terminate() {
        terminateCalls++;
        if (!ignoreTerminate) {
            exit(143);
        }
    }

    @Override
    public void kill() {
        killCalls++;
        exit(137);
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return exit;
    }

    public int terminateCalls() {
        return terminateCalls;
    }

    public int killCalls() {
        return killCalls;
    }
}
