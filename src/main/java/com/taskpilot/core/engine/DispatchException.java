package com.taskpilot.core.engine;

/**
 * A dispatch job could not start or was aborted. The message is meant for the operator.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
