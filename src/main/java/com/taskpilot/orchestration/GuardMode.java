package com.taskpilot.orchestration;

/**
 * What to do when the spawn admission check itself cannot be completed.
 */
public enum GuardMode {
    /** Log and spawn anyway. */
    FAIL_OPEN,
    /** Treat the failed check as a retryable denial. */
    STRICT
}
