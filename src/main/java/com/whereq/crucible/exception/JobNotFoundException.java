package com.whereq.crucible.exception;

/**
 * Exception thrown when a job id is not known to the dispatcher
 */
public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
