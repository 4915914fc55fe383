package com.taskpilot.worker;

import com.taskpilot.core.model.FailureKind;

import java.time.Duration;

/**
 * Why the watchdog stopped a worker.
 */
public enum KillReason {
    TIMEOUT(FailureKind.TIMEOUT, "Worker exceeded timeout"),
    LOG_STALL(FailureKind.LOG_STALL, "Worker log stalled");

    private final FailureKind failureKind;
    private final String label;

    KillReason(FailureKind failureKind, String label) {
        this.failureKind = failureKind;
        this.label = label;
    }

    public FailureKind failureKind() {
        return failureKind;
    }

    /** e.g. "Worker exceeded timeout (3600s)". */
    public String describe(Duration limit) {
        return label + " (" + limit.toSeconds() + "s)";
    }
}
