package com.taskpilot.orchestration;

/**
 * The orchestration service does not offer the spawn admission check.
 */
public class SpawnGuardUnsupportedException extends OrchestrationException {

    public SpawnGuardUnsupportedException(String message, int statusCode) {
        super(message, statusCode);
    }
}
