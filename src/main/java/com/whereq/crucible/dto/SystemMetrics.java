package com.whereq.crucible.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Aggregate orchestrator counters
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemMetrics {
    private long activeTests;
    private long queuedTests;
    private long completedTests;

    /**
     * Failed and timed-out jobs
     */
    private long failedTests;

    private long timedOutTests;
    private long cancelledTests;
    private Duration averageExecutionTime;
    private long totalProcessed;

    private int availableEnvironments;
    private int allocatedEnvironments;
    private int totalEnvironments;

    private int peakRunning;
    private int peakPending;

    private long timeoutsDetected;
    private Duration uptime;
}
