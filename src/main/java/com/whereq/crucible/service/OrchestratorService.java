package com.whereq.crucible.service;

import com.whereq.crucible.config.CrucibleProperties;
import com.whereq.crucible.dto.HealthReport;
import com.whereq.crucible.dto.JobStatusResponse;
import com.whereq.crucible.dto.SystemMetrics;
import com.whereq.crucible.exception.JobNotFoundException;
import com.whereq.crucible.model.ComponentHealth;
import com.whereq.crucible.model.Environment;
import com.whereq.crucible.model.EnvironmentStatus;
import com.whereq.crucible.model.HardwareProfile;
import com.whereq.crucible.model.HardwareRequirement;
import com.whereq.crucible.model.HealthState;
import com.whereq.crucible.model.Job;
import com.whereq.crucible.model.JobRequest;
import com.whereq.crucible.model.JobStatus;
import com.whereq.crucible.model.Priority;
import com.whereq.crucible.model.QueueSnapshot;
import com.whereq.crucible.model.TestCase;
import com.whereq.crucible.recovery.ErrorCategory;
import com.whereq.crucible.recovery.ErrorEvent;
import com.whereq.crucible.recovery.ErrorRecoveryManager;
import com.whereq.crucible.recovery.OrchestratorState;
import com.whereq.crucible.recovery.OrchestratorStateStore;
import com.whereq.crucible.resource.EnvironmentRegistry;
import com.whereq.crucible.resource.RemovalOutcome;
import com.whereq.crucible.resource.ResourceMatcher;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Top-level orchestrator lifecycle and facade.
 *
 * Components start in dependency order: environment registry, matcher,
 * dispatcher, timeout manager, error recovery, queue monitor. Start and stop are
 * idempotent.
 */
@Slf4j
@Service
public class OrchestratorService {

    private final CrucibleProperties properties;
    private final EnvironmentRegistry registry;
    private final ResourceMatcher matcher;
    private final JobDispatcher dispatcher;
    private final TimeoutManager timeoutManager;
    private final ErrorRecoveryManager recoveryManager;
    private final StatusTracker statusTracker;
    private final QueueMonitor queueMonitor;
    private final OrchestratorStateStore stateStore;

    private volatile boolean running;
    private volatile Instant startedAt;
    private volatile Instant lastSavedAt;

    @Autowired
    public OrchestratorService(CrucibleProperties properties,
                               EnvironmentRegistry registry,
                               ResourceMatcher matcher,
                               JobDispatcher dispatcher,
                               TimeoutManager timeoutManager,
                               ErrorRecoveryManager recoveryManager,
                               StatusTracker statusTracker,
                               QueueMonitor queueMonitor,
                               OrchestratorStateStore stateStore) {
        this.properties = properties;
        this.registry = registry;
        this.matcher = matcher;
        this.dispatcher = dispatcher;
        this.timeoutManager = timeoutManager;
        this.recoveryManager = recoveryManager;
        this.statusTracker = statusTracker;
        this.queueMonitor = queueMonitor;
        this.stateStore = stateStore;

        recoveryManager.addMaintenanceTask(this::maintenance);
        recoveryManager.registerRecoveryAction(ErrorCategory.ENVIRONMENT_FAILURE, this::environmentRestored);
        recoveryManager.registerRecoveryAction(ErrorCategory.RESOURCE_EXHAUSTION,
            event -> event.getJobId() != null && !dispatcher.isPlacementBlocked(event.getJobId()));
    }

    /**
     * A failed environment counts as recovered once an environment with its id is registered again
     */
    private boolean environmentRestored(ErrorEvent event) {
        return event.getEnvironmentId() != null && registry.get(event.getEnvironmentId())
            .filter(status -> !status.isRetired())
            .isPresent();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void autoStart() {
        if (properties.isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    /**
     * Start all components
     *
     * @return true once running, also when it already was
     */
    public synchronized boolean start() {
        if (running) {
            log.debug("Orchestrator already running");
            return true;
        }
        log.info("Starting test execution orchestrator");

        if (stateStore.isEnabled()) {
            restoreState();
        }

        registry.start();
        log.info("Resource matcher ready (lightweight jobs: <= {}MB, <= {})",
            properties.getMatching().getLightweightMemoryMb(), properties.getMatching().getLightweightDuration());
        dispatcher.start();
        timeoutManager.start(dispatcher::onDeadlineExpired);
        recoveryManager.start();
        queueMonitor.start();

        startedAt = Instant.now();
        lastSavedAt = startedAt;
        running = true;
        log.info("Test execution orchestrator started: {}", registry.getPoolSummary());
        return true;
    }

    /**
     * Stop all components, cancelling outstanding work
     *
     * @return true once stopped, also when it already was
     */
    public synchronized boolean stop() {
        if (!running) {
            log.debug("Orchestrator not running");
            return true;
        }
        log.info("Stopping test execution orchestrator");
        running = false;

        queueMonitor.stop();
        if (stateStore.isEnabled()) {
            saveState();
        }
        dispatcher.stop();
        timeoutManager.stop();
        recoveryManager.stop();
        registry.stop();

        log.info("Test execution orchestrator stopped after {}", uptime());
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Submit a test case; accepted whether or not the orchestrator is running
     *
     * @return job identifier
     */
    public String submitJob(TestCase testCase, Priority priority, double impactScore) {
        return dispatcher.submit(testCase, priority, impactScore);
    }

    public String submitJob(JobRequest request) {
        return dispatcher.submit(request);
    }

    /**
     * Current status and, once finished, the result of a job
     */
    public Optional<JobStatusResponse> getJobStatus(String jobId) {
        return dispatcher.getJob(jobId)
            .map(job -> JobStatusResponse.from(job, statusTracker.timeline(jobId)));
    }

    /**
     * @throws JobNotFoundException if the job is unknown
     * @throws IllegalStateException if the job already finished
     */
    public Job cancelJob(String jobId) {
        return dispatcher.cancel(jobId);
    }

    public QueueSnapshot getQueueStatus() {
        return dispatcher.snapshot();
    }

    public List<Job> getActiveJobs() {
        return dispatcher.activeJobs();
    }

    public Environment addEnvironment(String environmentId, HardwareProfile profile) {
        Environment environment = Environment.builder()
            .id(environmentId)
            .profile(profile)
            .registeredAt(Instant.now())
            .build();
        registry.register(environment);
        recoveryManager.attemptRecovery();
        return environment;
    }

    public RemovalOutcome removeEnvironment(String environmentId) {
        return dispatcher.removeEnvironment(environmentId);
    }

    /**
     * @return the job that was running on the environment, if any
     */
    public Optional<String> reportEnvironmentFailure(String environmentId, String reason) {
        return dispatcher.environmentFailed(environmentId, reason);
    }

    public List<EnvironmentStatus> listEnvironments() {
        return registry.list();
    }

    /**
     * Environment a job with this requirement would get right now, without allocating it
     */
    public Optional<EnvironmentStatus> findMatch(HardwareRequirement requirement, Duration estimatedDuration) {
        return matcher.findMatch(requirement, estimatedDuration, registry.idle());
    }

    public HealthReport getHealthStatus() {
        Map<String, ComponentHealth> components = new LinkedHashMap<>();
        probe(components, "environmentRegistry", registry::health);
        probe(components, "dispatcher", dispatcher::health);
        probe(components, "timeoutManager", timeoutManager::health);
        probe(components, "errorRecovery", recoveryManager::health);
        probe(components, "statusTracker", statusTracker::health);
        probe(components, "queueMonitor", queueMonitor::health);

        HealthState state;
        String message = null;
        if (!running) {
            state = HealthState.STOPPED;
        } else {
            List<String> degraded = new ArrayList<>();
            components.forEach((name, health) -> {
                if (health.getState() != HealthState.HEALTHY) {
                    degraded.add(name + (health.getMessage() != null ? ": " + health.getMessage() : ""));
                }
            });
            String maintenanceFailure = recoveryManager.componentFailure("maintenance");
            if (maintenanceFailure != null) {
                degraded.add("maintenance: " + maintenanceFailure);
            }
            state = degraded.isEmpty() ? HealthState.HEALTHY : HealthState.DEGRADED;
            message = degraded.isEmpty() ? null : String.join("; ", degraded);
        }

        return HealthReport.builder()
            .status(state)
            .running(running)
            .startedAt(startedAt)
            .uptime(uptime())
            .message(message)
            .components(components)
            .errors(recoveryManager.getErrorSummary())
            .build();
    }

    private void probe(Map<String, ComponentHealth> components, String name, Supplier<ComponentHealth> probe) {
        try {
            components.put(name, probe.get());
        } catch (Exception e) {
            log.error("Health probe of {} failed", name, e);
            components.put(name, ComponentHealth.degraded(name, "Health probe failed: " + e.getMessage()));
        }
    }

    public SystemMetrics getSystemMetrics() {
        StatusTracker.TrackerMetrics tracked = statusTracker.metrics();
        QueueSnapshot snapshot = dispatcher.snapshot();
        return SystemMetrics.builder()
            .activeTests(tracked.getActiveTests())
            .queuedTests(tracked.getQueuedTests())
            .completedTests(tracked.getCompletedTests())
            .failedTests(tracked.getFailedTests())
            .timedOutTests(tracked.getTimedOutTests())
            .cancelledTests(tracked.getCancelledTests())
            .averageExecutionTime(tracked.getAverageExecutionTime())
            .totalProcessed(dispatcher.getTotalProcessed())
            .availableEnvironments(snapshot.getAvailableEnvironments())
            .allocatedEnvironments(snapshot.getAllocatedEnvironments())
            .totalEnvironments(snapshot.getTotalEnvironments())
            .peakRunning(dispatcher.getPeakRunning())
            .peakPending(dispatcher.getPeakPending())
            .timeoutsDetected(timeoutManager.getTimeoutsDetected())
            .uptime(uptime())
            .build();
    }

    private Duration uptime() {
        Instant started = startedAt;
        return running && started != null ? Duration.between(started, Instant.now()) : Duration.ZERO;
    }

    private void maintenance() {
        dispatcher.purgeFinished(properties.getStatusRetention());
        if (running && stateStore.isEnabled()) {
            Instant last = lastSavedAt;
            if (last == null || !Instant.now().isBefore(last.plus(properties.getPersistence().getSaveInterval()))) {
                saveState();
            }
        }
    }

    /**
     * Write the current state to the state file
     *
     * @return true if written
     */
    public boolean saveState() {
        StatusTracker.TrackerMetrics tracked = statusTracker.metrics();
        List<OrchestratorState.SavedJob> saved = new ArrayList<>();
        for (Job job : dispatcher.activeJobs()) {
            saved.add(OrchestratorState.SavedJob.builder()
                .jobId(job.getJobId())
                .testCase(job.getTestCase())
                .priority(job.getPriority())
                .impactScore(job.getImpactScore())
                .planId(job.getPlanId())
                .notifications(job.getNotifications())
                .interrupted(job.getStatus() == JobStatus.RUNNING)
                .dependencies(new ArrayList<>(job.getDependencies()))
                .build());
        }

        OrchestratorState state = OrchestratorState.builder()
            .savedAt(Instant.now())
            .counters(OrchestratorState.Counters.builder()
                .completedTests(tracked.getCompletedTests())
                .failedTests(tracked.getFailedTests())
                .timedOutTests(tracked.getTimedOutTests())
                .cancelledTests(tracked.getCancelledTests())
                .measuredExecutions(statusTracker.getMeasuredExecutions())
                .averageExecutionTime(tracked.getAverageExecutionTime())
                .build())
            .pendingJobs(saved)
            .processedPlanIds(new ArrayList<>(queueMonitor.getProcessedPlans()))
            .build();

        try {
            stateStore.save(state);
            lastSavedAt = state.getSavedAt();
            log.info("Saved orchestrator state: {} unfinished jobs", saved.size());
            return true;
        } catch (IOException e) {
            log.error("Failed to save orchestrator state to {}", stateStore.stateFile(), e);
            recoveryManager.componentFailed("persistence", e);
            return false;
        }
    }

    private void restoreState() {
        Optional<OrchestratorState> loaded = stateStore.load();
        if (loaded.isEmpty()) {
            log.info("No saved orchestrator state at {}", stateStore.stateFile());
            return;
        }
        OrchestratorState state = loaded.get();

        OrchestratorState.Counters counters = state.getCounters();
        if (counters != null) {
            statusTracker.restore(StatusTracker.TrackerMetrics.builder()
                .completedTests(counters.getCompletedTests())
                .failedTests(counters.getFailedTests())
                .timedOutTests(counters.getTimedOutTests())
                .cancelledTests(counters.getCancelledTests())
                .averageExecutionTime(counters.getAverageExecutionTime())
                .build(), counters.getMeasuredExecutions());
        }
        queueMonitor.restoreProcessedPlans(state.getProcessedPlanIds());

        Set<String> planIds = new LinkedHashSet<>();
        for (OrchestratorState.SavedJob saved : state.getPendingJobs()) {
            if (saved.getPlanId() != null && planIds.add(saved.getPlanId())) {
                statusTracker.registerPlan(saved.getPlanId());
            }
        }

        Set<String> savedIds = new LinkedHashSet<>();
        for (OrchestratorState.SavedJob saved : state.getPendingJobs()) {
            savedIds.add(saved.getJobId());
        }

        // restored jobs get new ids, so a job is resubmitted only after the jobs it waits for
        Map<String, String> restoredIds = new LinkedHashMap<>();
        List<OrchestratorState.SavedJob> remaining = new ArrayList<>(state.getPendingJobs());
        boolean progress = true;
        while (!remaining.isEmpty() && progress) {
            progress = false;
            Iterator<OrchestratorState.SavedJob> it = remaining.iterator();
            while (it.hasNext()) {
                OrchestratorState.SavedJob saved = it.next();
                List<String> dependencies = new ArrayList<>();
                boolean ready = true;
                for (String dependency : saved.getDependencies()) {
                    if (!savedIds.contains(dependency)) {
                        // finished before the save; failures already cancelled their dependents
                        continue;
                    }
                    String restoredId = restoredIds.get(dependency);
                    if (restoredId == null) {
                        ready = false;
                        break;
                    }
                    dependencies.add(restoredId);
                }
                if (!ready) {
                    continue;
                }
                it.remove();
                progress = true;
                restoreJob(saved, dependencies).ifPresent(jobId -> restoredIds.put(saved.getJobId(), jobId));
            }
        }
        remaining.forEach(saved -> log.warn("Dropping saved job {}: its dependencies could not be restored",
            saved.getJobId()));
        planIds.forEach(statusTracker::sealPlan);
        log.info("Restored {} unfinished jobs from {}", restoredIds.size(), stateStore.stateFile());
    }

    private Optional<String> restoreJob(OrchestratorState.SavedJob saved, List<String> dependencies) {
        try {
            String jobId = dispatcher.submit(JobRequest.builder()
                .testCase(saved.getTestCase())
                .priority(saved.getPriority() != null ? saved.getPriority() : Priority.MEDIUM)
                .impactScore(saved.getImpactScore())
                .planId(saved.getPlanId())
                .notifications(saved.getNotifications())
                .dependencies(dependencies)
                .build());
            log.info("Restored {} job {} as {}", saved.isInterrupted() ? "interrupted" : "pending",
                saved.getJobId(), jobId);
            return Optional.of(jobId);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping saved job {}: {}", saved.getJobId(), e.getMessage());
            return Optional.empty();
        }
    }
}
