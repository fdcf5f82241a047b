package com.healthrevo.decision.exception;

/**
 * Raised when a pipeline run would break a persistent-state invariant, such as creating a second
 * open alert for a condition that is already open. The run must be abandoned without persisting
 * anything; callers may retry it as a whole.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
