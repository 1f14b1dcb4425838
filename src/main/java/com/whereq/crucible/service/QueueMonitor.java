package com.whereq.crucible.service;

import com.whereq.crucible.config.CrucibleProperties;
import com.whereq.crucible.model.ComponentHealth;
import com.whereq.crucible.model.ExecutionPlan;
import com.whereq.crucible.model.HealthState;
import com.whereq.crucible.model.JobRequest;
import com.whereq.crucible.model.PlanStatus;
import com.whereq.crucible.model.Priority;
import com.whereq.crucible.model.TestCase;
import com.whereq.crucible.plan.ExecutionPlanSource;
import com.whereq.crucible.recovery.ErrorCategory;
import com.whereq.crucible.recovery.ErrorRecoveryManager;
import com.whereq.crucible.recovery.ErrorSeverity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polls the execution plan source and turns new plans into jobs
 */
@Slf4j
@Service
public class QueueMonitor {

    private static final String COMPONENT = "queueMonitor";

    private final CrucibleProperties properties;
    private final ExecutionPlanSource planSource;
    private final JobDispatcher dispatcher;
    private final StatusTracker statusTracker;
    private final ErrorRecoveryManager recoveryManager;

    private final Set<String> processedPlans = ConcurrentHashMap.newKeySet();

    private final AtomicLong plansDetected = new AtomicLong();
    private final AtomicLong jobsCreated = new AtomicLong();

    private volatile Instant lastPollAt;
    private volatile String lastPollError;

    private ScheduledExecutorService pollExecutor;

    @Autowired
    public QueueMonitor(CrucibleProperties properties,
                        ExecutionPlanSource planSource,
                        JobDispatcher dispatcher,
                        StatusTracker statusTracker,
                        ErrorRecoveryManager recoveryManager) {
        this.properties = properties;
        this.planSource = planSource;
        this.dispatcher = dispatcher;
        this.statusTracker = statusTracker;
        this.recoveryManager = recoveryManager;
    }

    public synchronized void start() {
        if (pollExecutor != null) {
            return;
        }
        long period = properties.getMonitor().getPlanPollInterval().toMillis();
        pollExecutor = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("crucible-monitor-"));
        pollExecutor.scheduleWithFixedDelay(this::pollSafely, 0, period, TimeUnit.MILLISECONDS);
        log.info("Queue monitor started, polling {} plan source every {}ms", planSource.name(), period);
    }

    public synchronized void stop() {
        if (pollExecutor == null) {
            return;
        }
        pollExecutor.shutdownNow();
        try {
            pollExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        pollExecutor = null;
        log.info("Queue monitor stopped");
    }

    public boolean isRunning() {
        return pollExecutor != null;
    }

    /**
     * Poll the plan source once: publish finished plan statuses, then convert
     * every QUEUED plan not seen before into jobs.
     *
     * @return number of new plans found
     */
    public int poll() {
        publishFinishedPlans();

        List<ExecutionPlan> queued = planSource.fetchQueuedPlans();
        int newPlans = 0;
        for (ExecutionPlan plan : queued) {
            if (plan.getPlanId() == null || !processedPlans.add(plan.getPlanId())) {
                continue;
            }
            newPlans++;
            plansDetected.incrementAndGet();
            queuePlan(plan);
        }
        lastPollAt = Instant.now();
        if (newPlans > 0) {
            log.info("Found {} new execution plans", newPlans);
        }
        return newPlans;
    }

    private void queuePlan(ExecutionPlan plan) {
        Priority priority = Priority.fromPlanPriority(plan.getPriority());
        statusTracker.registerPlan(plan.getPlanId());

        int created = 0;
        for (String testCaseId : plan.getTestCaseIds()) {
            Optional<TestCase> testCase = planSource.findTestCase(testCaseId);
            if (testCase.isEmpty()) {
                log.warn("Plan {} references unknown test case {}", plan.getPlanId(), testCaseId);
                recoveryManager.report(ErrorCategory.CONFIGURATION, ErrorSeverity.LOW, COMPONENT,
                    "Unknown test case " + testCaseId + " in plan " + plan.getPlanId(), null, null);
                continue;
            }
            try {
                dispatcher.submit(JobRequest.builder()
                    .testCase(testCase.get())
                    .priority(priority)
                    .planId(plan.getPlanId())
                    .build());
                created++;
            } catch (IllegalArgumentException e) {
                log.warn("Plan {} test case {} rejected: {}", plan.getPlanId(), testCaseId, e.getMessage());
            }
        }
        jobsCreated.addAndGet(created);

        if (created == 0) {
            log.warn("Plan {} produced no jobs, marking it failed", plan.getPlanId());
            statusTracker.failPlan(plan.getPlanId());
        } else {
            log.info("Queued plan {}: {} jobs at priority {}", plan.getPlanId(), created, priority);
            planSource.updatePlanStatus(plan.getPlanId(), PlanStatus.RUNNING);
            statusTracker.sealPlan(plan.getPlanId());
        }
    }

    private void publishFinishedPlans() {
        Map<String, PlanStatus> finished = statusTracker.drainFinishedPlans();
        finished.forEach((planId, status) -> {
            planSource.updatePlanStatus(planId, status);
            log.info("Plan {} marked {}", planId, status);
        });
    }

    private void pollSafely() {
        try {
            poll();
            if (lastPollError != null) {
                log.info("Plan source {} reachable again", planSource.name());
            }
            lastPollError = null;
            recoveryManager.componentRecovered(COMPONENT);
        } catch (Exception e) {
            log.error("Error polling {} plan source", planSource.name(), e);
            if (lastPollError == null) {
                recoveryManager.report(ErrorCategory.EXTERNAL_SOURCE, ErrorSeverity.MEDIUM, COMPONENT,
                    String.valueOf(e.getMessage()), null, null);
            }
            lastPollError = String.valueOf(e.getMessage());
        }
    }

    /**
     * Plan ids already converted into jobs
     */
    public Set<String> getProcessedPlans() {
        return Set.copyOf(processedPlans);
    }

    public void restoreProcessedPlans(Collection<String> planIds) {
        processedPlans.addAll(planIds);
    }

    public ComponentHealth health() {
        ComponentHealth.ComponentHealthBuilder builder = ComponentHealth.builder()
            .component(COMPONENT)
            .detail("planSource", planSource.name())
            .detail("plansDetected", plansDetected.get())
            .detail("jobsCreated", jobsCreated.get())
            .detail("lastPollAt", lastPollAt != null ? lastPollAt.toString() : "never");
        if (!isRunning()) {
            return builder.state(HealthState.STOPPED).build();
        }
        if (lastPollError != null) {
            return builder.state(HealthState.DEGRADED).message(lastPollError).build();
        }
        return builder.state(HealthState.HEALTHY).build();
    }
}
