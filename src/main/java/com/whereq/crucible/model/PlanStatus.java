package com.whereq.crucible.model;

/**
 * Lifecycle of an execution plan in the plan source
 */
public enum PlanStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
