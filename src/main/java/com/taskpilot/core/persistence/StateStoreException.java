package com.taskpilot.core.persistence;

/**
 * Raised when the job state snapshot cannot be written.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
