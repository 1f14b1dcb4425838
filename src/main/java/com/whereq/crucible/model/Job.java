package com.whereq.crucible.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * A submitted test execution tracked by the dispatcher.
 * Mutated only while the dispatcher lock is held.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Job {

    /**
     * Admission order: higher priority first, then submission sequence
     */
    public static final Comparator<Job> ADMISSION_ORDER = Comparator
        .comparingInt((Job job) -> job.getPriority().rank()).reversed()
        .thenComparingLong(Job::getSequence);

    @EqualsAndHashCode.Include
    private String jobId;

    private TestCase testCase;

    private Priority priority;

    /**
     * Estimated value of the test, 0.0 to 1.0. Reported, never used for ordering.
     */
    private double impactScore;

    /**
     * Monotonic submission sequence, FIFO tie-breaker within a priority
     */
    private long sequence;

    /**
     * Execution plan the job was created from, if any
     */
    private String planId;

    private Notifications notifications;

    /**
     * Jobs that must complete before this one is admitted
     */
    @Builder.Default
    private List<String> dependencies = List.of();

    private Instant submittedAt;

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    /**
     * Assigned environment, non-null exactly while RUNNING
     */
    private String environmentId;

    private Instant startedAt;

    private Instant deadline;

    /**
     * Earliest admission time after a failed attempt
     */
    private Instant notBefore;

    /**
     * Zero-based attempt counter
     */
    private int attempt;

    /**
     * Re-queued while the previous attempt's process is still being terminated
     */
    private boolean awaitingTermination;

    private String lastError;

    private JobResult result;

    private Instant finishedAt;

    public boolean isBackingOff(Instant now) {
        return notBefore != null && now.isBefore(notBefore);
    }

    public boolean dependsOn(String jobId) {
        return dependencies != null && dependencies.contains(jobId);
    }
}
