package com.whereq.crucible.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * PENDING → RUNNING → {COMPLETED, FAILED, TIMEOUT, CANCELLED}
 * PENDING → CANCELLED
 * RUNNING → PENDING (retry after a failed attempt)
 */
public enum JobStatus {
    /**
     * Waiting in the priority queue for a compatible environment
     */
    PENDING,

    /**
     * Holding an environment, runner executing
     */
    RUNNING,

    /**
     * Runner finished with exit code 0
     */
    COMPLETED,

    /**
     * Non-zero exit code, runner error or environment lost
     */
    FAILED,

    /**
     * Exceeded its deadline and was terminated
     */
    TIMEOUT,

    /**
     * Cancelled by a caller or by service shutdown
     */
    CANCELLED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT || this == CANCELLED;
    }

    /**
     * Check if job still occupies the orchestrator (queued or executing)
     */
    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    /**
     * Check if this terminal state counts as a failure
     */
    public boolean isFailure() {
        return this == FAILED || this == TIMEOUT;
    }
}
