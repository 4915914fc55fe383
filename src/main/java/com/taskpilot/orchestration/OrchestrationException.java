package com.taskpilot.orchestration;

/**
 * A call to the orchestration service failed.
 */
public class OrchestrationException extends RuntimeException {

    private final int statusCode;

    public OrchestrationException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when the request never got a response. */
    public int statusCode() {
        return statusCode;
    }
}
