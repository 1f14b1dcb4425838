package com.whereq.crucible.recovery;

import com.whereq.crucible.model.Notifications;
import com.whereq.crucible.model.Priority;
import com.whereq.crucible.model.TestCase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot written to the state file
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestratorState {

    private Instant savedAt;

    private Counters counters;

    /**
     * Pending and interrupted running jobs, in admission order
     */
    @Builder.Default
    private List<SavedJob> pendingJobs = new ArrayList<>();

    @Builder.Default
    private List<String> processedPlanIds = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Counters {
        private long completedTests;
        private long failedTests;
        private long timedOutTests;
        private long cancelledTests;
        private long measuredExecutions;
        private Duration averageExecutionTime;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SavedJob {
        private String jobId;
        private TestCase testCase;
        private Priority priority;
        private double impactScore;
        private String planId;
        private Notifications notifications;
        private boolean interrupted;

        /**
         * Saved ids of unfinished jobs this one waits for
         */
        @Builder.Default
        private List<String> dependencies = new ArrayList<>();
    }
}
