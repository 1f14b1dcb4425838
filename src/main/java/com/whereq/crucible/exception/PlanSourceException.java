package com.whereq.crucible.exception;

/**
 * Exception thrown when the execution plan source cannot be read or updated
 */
public class PlanSourceException extends RuntimeException {
    public PlanSourceException(String message) {
        super(message);
    }

    public PlanSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
