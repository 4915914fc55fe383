package com.taskpilot.worker;

import com.taskpilot.core.model.Task;

import java.nio.file.Path;
import java.time.Instant;

/**
 * In-memory record of a dispatched attempt whose process is alive. The watchdog fields are
 * mutated only by the dispatch loop thread.
 */
public class RunningWorker {

    public enum KillState { NONE, SIGTERM_SENT, SIGKILL_SENT }

    private final Task task;
    private final int attempt;
    private final WorkerHandle handle;
    private final Instant startedAt;
    private KillState killState = KillState.NONE;
    private Instant graceDeadline;
    private KillReason forcedFailure;
    private String forcedFailureDetail;

    public RunningWorker(Task task, int attempt, WorkerHandle handle, Instant startedAt) {
        this.task = task;
        this.attempt = attempt;
        this.handle = handle;
        this.startedAt = startedAt;
    }

    void markTerminated(KillReason reason, String detail, Instant deadline) {
        this.killState = KillState.SIGTERM_SENT;
        this.forcedFailure = reason;
        this.forcedFailureDetail = detail;
        this.graceDeadline = deadline;
    }

    void markKilled() {
        this.killState = KillState.SIGKILL_SENT;
    }

    public Task task() { return task; }
    public int attempt() { return attempt; }
    public WorkerHandle handle() { return handle; }
    public Instant startedAt() { return startedAt; }
    public Path logPath() { return handle.logPath(); }
    public KillState killState() { return killState; }
    public Instant graceDeadline() { return graceDeadline; }
    public KillReason forcedFailure() { return forcedFailure; }
    public String forcedFailureDetail() { return forcedFailureDetail; }
}
