package com.whereq.crucible.exception;

/**
 * Exception thrown when registering an environment id that is already in the pool
 */
public class EnvironmentConflictException extends RuntimeException {
    public EnvironmentConflictException(String message) {
        super(message);
    }
}
