package com.whereq.crucible.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of an environment and its allocation
 */
@Value
@Builder
public class EnvironmentStatus {
    Environment environment;
    AllocationState state;

    /**
     * Job currently holding the environment, null when idle
     */
    String allocatedTo;

    /**
     * Deregistered while allocated, leaves the pool on release
     */
    boolean retired;

    /**
     * Last release time, null if never used
     */
    Instant lastReleasedAt;

    long executionCount;
    Duration busyTime;

    public String getId() {
        return environment.getId();
    }

    public boolean isIdle() {
        return state == AllocationState.IDLE && !retired;
    }
}
