package com.whereq.crucible.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable outcome of a finished job
 */
@Value
@Builder
public class JobResult {
    /**
     * Job identifier
     */
    String jobId;

    /**
     * Final status
     */
    JobStatus status;

    /**
     * Wall-clock execution time
     */
    Duration executionTime;

    /**
     * Environment the job ran on, null if it never started
     */
    String environmentId;

    String stdout;

    String stderr;

    /**
     * Runner exit code, null if the runner never returned one
     */
    Integer exitCode;

    /**
     * Error message if failed, timed out or cancelled
     */
    String errorMessage;

    boolean kernelPanic;

    /**
     * When the job completed
     */
    Instant completedAt;
}
