package com.whereq.crucible.model;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time queue and pool counts
 */
@Value
@Builder
public class QueueSnapshot {
    int runningJobs;
    int pendingJobs;
    int availableEnvironments;
    int allocatedEnvironments;
    int totalEnvironments;
}
