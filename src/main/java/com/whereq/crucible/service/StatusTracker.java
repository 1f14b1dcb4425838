package com.whereq.crucible.service;

import com.whereq.crucible.config.CrucibleProperties;
import com.whereq.crucible.model.ComponentHealth;
import com.whereq.crucible.model.HealthState;
import com.whereq.crucible.model.JobStatus;
import com.whereq.crucible.model.PlanStatus;
import com.whereq.crucible.model.StatusTransition;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Track job state transitions, aggregate counters and execution plan progress
 */
@Slf4j
@Service
public class StatusTracker {

    private final CrucibleProperties properties;

    private final Map<String, JobTimeline> timelines = new HashMap<>();

    private final Map<String, PlanProgress> plans = new HashMap<>();

    private final Set<String> finishedPlans = new LinkedHashSet<>();

    private long activeTests;
    private long queuedTests;
    private long completedTests;
    private long failedTests;
    private long timedOutTests;
    private long cancelledTests;
    private long measuredExecutions;
    private Duration totalExecutionTime = Duration.ZERO;

    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter timeoutCounter;
    private final Counter cancelledCounter;
    private final Timer executionTimer;

    @Autowired
    public StatusTracker(CrucibleProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;

        completedCounter = Counter.builder("crucible.jobs.completed")
            .description("Number of jobs completed successfully")
            .register(meterRegistry);

        failedCounter = Counter.builder("crucible.jobs.failed")
            .description("Number of failed jobs")
            .register(meterRegistry);

        timeoutCounter = Counter.builder("crucible.jobs.timeout")
            .description("Number of jobs terminated at their deadline")
            .register(meterRegistry);

        cancelledCounter = Counter.builder("crucible.jobs.cancelled")
            .description("Number of cancelled jobs")
            .register(meterRegistry);

        executionTimer = Timer.builder("crucible.jobs.execution.time")
            .description("Job execution time")
            .register(meterRegistry);
    }

    /**
     * Record a job entering the queue
     *
     * @param jobId job identifier
     * @param planId plan the job belongs to, may be null
     */
    public synchronized void recordSubmitted(String jobId, String planId) {
        JobTimeline timeline = new JobTimeline(planId);
        timeline.transitions.add(new StatusTransition(jobId, null, JobStatus.PENDING, Instant.now(), "submitted"));
        timelines.put(jobId, timeline);
        queuedTests++;
        if (planId != null) {
            PlanProgress progress = plans.get(planId);
            if (progress != null) {
                progress.jobIds.add(jobId);
            }
        }
        log.debug("Job {} status recorded: PENDING", jobId);
    }

    /**
     * Record a state change
     *
     * @param jobId job identifier
     * @param from previous status
     * @param to new status
     * @param detail free-form detail (environment, error)
     * @param executionTime execution time for terminal transitions of started jobs, else null
     */
    public synchronized void record(String jobId, JobStatus from, JobStatus to, String detail, Duration executionTime) {
        JobTimeline timeline = timelines.computeIfAbsent(jobId, id -> new JobTimeline(null));
        timeline.transitions.add(new StatusTransition(jobId, from, to, Instant.now(), detail));

        decrement(from);
        switch (to) {
            case PENDING -> queuedTests++;
            case RUNNING -> activeTests++;
            case COMPLETED -> {
                completedTests++;
                completedCounter.increment();
            }
            case FAILED -> {
                failedTests++;
                failedCounter.increment();
            }
            case TIMEOUT -> {
                failedTests++;
                timedOutTests++;
                timeoutCounter.increment();
            }
            case CANCELLED -> {
                cancelledTests++;
                cancelledCounter.increment();
            }
        }

        if (to.isTerminal()) {
            timeline.finishedAt = Instant.now();
            if (executionTime != null && to != JobStatus.CANCELLED) {
                measuredExecutions++;
                totalExecutionTime = totalExecutionTime.plus(executionTime);
                executionTimer.record(executionTime);
            }
            updatePlan(timeline.planId, to);
        }

        log.info("Job {} status updated: {} → {}{}", jobId, from, to, detail != null ? " (" + detail + ")" : "");
    }

    private void decrement(JobStatus from) {
        if (from == JobStatus.PENDING) {
            queuedTests = Math.max(0, queuedTests - 1);
        } else if (from == JobStatus.RUNNING) {
            activeTests = Math.max(0, activeTests - 1);
        }
    }

    /**
     * Timeline of a job in recording order
     */
    public synchronized List<StatusTransition> timeline(String jobId) {
        JobTimeline timeline = timelines.get(jobId);
        return timeline != null ? List.copyOf(timeline.transitions) : Collections.emptyList();
    }

    /**
     * Start tracking a plan; jobs recorded with its id afterwards count towards it
     */
    public synchronized void registerPlan(String planId) {
        plans.putIfAbsent(planId, new PlanProgress(planId));
    }

    /**
     * Mark a plan finished without any job, e.g. none of its test cases resolved
     */
    public synchronized void failPlan(String planId) {
        PlanProgress progress = plans.computeIfAbsent(planId, PlanProgress::new);
        progress.status = PlanStatus.FAILED;
        finishedPlans.add(planId);
    }

    /**
     * Stop accepting new jobs for a plan, it finishes when all recorded jobs are terminal
     */
    public synchronized void sealPlan(String planId) {
        PlanProgress progress = plans.get(planId);
        if (progress == null) {
            return;
        }
        progress.sealed = true;
        checkPlanFinished(progress);
    }

    public synchronized Map<String, PlanStatus> planStatuses() {
        Map<String, PlanStatus> statuses = new HashMap<>();
        plans.forEach((id, progress) -> statuses.put(id, progress.status));
        return statuses;
    }

    /**
     * Plans that reached a final status since the last call
     */
    public synchronized Map<String, PlanStatus> drainFinishedPlans() {
        Map<String, PlanStatus> drained = new HashMap<>();
        for (String planId : finishedPlans) {
            PlanProgress progress = plans.get(planId);
            if (progress != null) {
                drained.put(planId, progress.status);
            }
        }
        finishedPlans.clear();
        return drained;
    }

    private void updatePlan(String planId, JobStatus terminal) {
        if (planId == null) {
            return;
        }
        PlanProgress progress = plans.get(planId);
        if (progress == null) {
            return;
        }
        progress.finished++;
        if (terminal.isFailure()) {
            progress.failed++;
        }
        checkPlanFinished(progress);
    }

    private void checkPlanFinished(PlanProgress progress) {
        if (progress.status == PlanStatus.COMPLETED || progress.status == PlanStatus.FAILED) {
            return;
        }
        if (progress.sealed && progress.finished >= progress.jobIds.size()) {
            progress.status = progress.failed > 0 || progress.jobIds.isEmpty() ? PlanStatus.FAILED : PlanStatus.COMPLETED;
            finishedPlans.add(progress.planId);
            log.info("Plan {} finished: {} ({} jobs, {} failed)",
                progress.planId, progress.status, progress.jobIds.size(), progress.failed);
        } else {
            progress.status = PlanStatus.RUNNING;
        }
    }

    public synchronized TrackerMetrics metrics() {
        Duration average = measuredExecutions > 0
            ? totalExecutionTime.dividedBy(measuredExecutions)
            : Duration.ZERO;
        return TrackerMetrics.builder()
            .activeTests(activeTests)
            .queuedTests(queuedTests)
            .completedTests(completedTests)
            .failedTests(failedTests)
            .timedOutTests(timedOutTests)
            .cancelledTests(cancelledTests)
            .averageExecutionTime(average)
            .build();
    }

    /**
     * Restore counters of finished jobs saved by a previous run
     */
    public synchronized void restore(TrackerMetrics saved, long savedMeasuredExecutions) {
        completedTests += saved.getCompletedTests();
        failedTests += saved.getFailedTests();
        timedOutTests += saved.getTimedOutTests();
        cancelledTests += saved.getCancelledTests();
        if (savedMeasuredExecutions > 0 && saved.getAverageExecutionTime() != null) {
            measuredExecutions += savedMeasuredExecutions;
            totalExecutionTime = totalExecutionTime.plus(saved.getAverageExecutionTime().multipliedBy(savedMeasuredExecutions));
        }
        log.info("Restored job counters: {} completed, {} failed", completedTests, failedTests);
    }

    public synchronized long getMeasuredExecutions() {
        return measuredExecutions;
    }

    /**
     * Remove timelines of jobs finished before the retention period
     *
     * @return number of timelines removed
     */
    public synchronized int cleanupOldStatuses(Duration retention) {
        Instant cutoff = Instant.now().minus(retention);
        int removed = 0;
        Iterator<JobTimeline> it = timelines.values().iterator();
        while (it.hasNext()) {
            JobTimeline timeline = it.next();
            if (timeline.finishedAt != null && timeline.finishedAt.isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        Collection<PlanProgress> finished = new ArrayList<>();
        for (PlanProgress progress : plans.values()) {
            if ((progress.status == PlanStatus.COMPLETED || progress.status == PlanStatus.FAILED)
                && progress.jobIds.stream().noneMatch(timelines::containsKey)) {
                finished.add(progress);
            }
        }
        finished.forEach(progress -> plans.remove(progress.planId));
        if (removed > 0) {
            log.info("Cleaned up {} finished job timelines older than {}", removed, retention);
        }
        return removed;
    }

    @Scheduled(fixedRateString = "${crucible.status-cleanup-interval:3600000}")
    public void scheduledCleanup() {
        cleanupOldStatuses(properties.getStatusRetention());
    }

    public ComponentHealth health() {
        TrackerMetrics metrics = metrics();
        return ComponentHealth.builder()
            .component("statusTracker")
            .state(HealthState.HEALTHY)
            .detail("activeTests", metrics.getActiveTests())
            .detail("queuedTests", metrics.getQueuedTests())
            .build();
    }

    /**
     * Aggregate job counters
     */
    @Value
    @Builder
    public static class TrackerMetrics {
        long activeTests;
        long queuedTests;
        long completedTests;
        long failedTests;
        long timedOutTests;
        long cancelledTests;
        Duration averageExecutionTime;
    }

    private static final class JobTimeline {
        private final String planId;
        private final List<StatusTransition> transitions = new ArrayList<>();
        private Instant finishedAt;

        private JobTimeline(String planId) {
            this.planId = planId;
        }
    }

    private static final class PlanProgress {
        private final String planId;
        private final Set<String> jobIds = new LinkedHashSet<>();
        private PlanStatus status = PlanStatus.QUEUED;
        private int finished;
        private int failed;
        private boolean sealed;

        private PlanProgress(String planId) {
            this.planId = planId;
        }
    }
}
