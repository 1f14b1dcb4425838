package com.whereq.crucible.model;

/**
 * Allocation state of a registered environment
 */
public enum AllocationState {
    IDLE,
    ALLOCATED
}
