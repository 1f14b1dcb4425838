package com.whereq.crucible.model;

/**
 * Aggregate health of the orchestrator or of one component
 */
public enum HealthState {
    HEALTHY,
    DEGRADED,
    STOPPED
}
