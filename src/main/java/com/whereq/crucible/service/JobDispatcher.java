package com.whereq.crucible.service;

import com.whereq.crucible.config.CrucibleProperties;
import com.whereq.crucible.exception.JobNotFoundException;
import com.whereq.crucible.executor.RunnerOutput;
import com.whereq.crucible.executor.TestRunner;
import com.whereq.crucible.model.ComponentHealth;
import com.whereq.crucible.model.Environment;
import com.whereq.crucible.model.EnvironmentStatus;
import com.whereq.crucible.model.HealthState;
import com.whereq.crucible.model.Job;
import com.whereq.crucible.model.JobRequest;
import com.whereq.crucible.model.JobResult;
import com.whereq.crucible.model.JobStatus;
import com.whereq.crucible.model.Priority;
import com.whereq.crucible.model.QueueSnapshot;
import com.whereq.crucible.model.RetryPolicy;
import com.whereq.crucible.model.TestCase;
import com.whereq.crucible.queue.JobQueue;
import com.whereq.crucible.queue.PriorityJobQueue;
import com.whereq.crucible.recovery.ErrorCategory;
import com.whereq.crucible.recovery.ErrorRecoveryManager;
import com.whereq.crucible.recovery.ErrorSeverity;
import com.whereq.crucible.resource.EnvironmentRegistry;
import com.whereq.crucible.resource.PoolSnapshot;
import com.whereq.crucible.resource.RemovalOutcome;
import com.whereq.crucible.resource.ResourceMatcher;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority scheduler and dispatcher.
 *
 * Pending jobs wait in a priority queue. A single admission thread wakes up every
 * poll interval, or earlier when signalled, and starts every pending job it can
 * place on a compatible idle environment while the running count stays under the
 * concurrency limit. A job with dependencies waits until every one of them has
 * COMPLETED and is cancelled when one ends any other way. Each running job
 * executes on its own worker thread.
 *
 * Every job leaves RUNNING exactly once, through {@link #finish}, which also
 * releases its environment.
 */
@Slf4j
@Service
public class JobDispatcher {

    private static final String COMPONENT = "dispatcher";

    private final CrucibleProperties properties;
    private final EnvironmentRegistry registry;
    private final ResourceMatcher matcher;
    private final TimeoutManager timeoutManager;
    private final StatusTracker statusTracker;
    private final ErrorRecoveryManager recoveryManager;
    private final WebhookNotifier webhookNotifier;
    private final TestRunner runner;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();
    private final Condition idle = lock.newCondition();

    private final Map<String, Job> jobs = new HashMap<>();
    private final JobQueue pending = new PriorityJobQueue();
    private final Map<String, Future<?>> executions = new HashMap<>();
    private final Set<String> exhaustionReported = new HashSet<>();
    private final AtomicLong sequence = new AtomicLong();

    private boolean wakeRequested;
    private int runningCount;
    private int peakRunning;
    private int peakPending;
    private long totalProcessed;

    private volatile boolean running;
    private Thread admissionThread;
    private ExecutorService workers;

    @Autowired
    public JobDispatcher(CrucibleProperties properties,
                         EnvironmentRegistry registry,
                         ResourceMatcher matcher,
                         TimeoutManager timeoutManager,
                         StatusTracker statusTracker,
                         ErrorRecoveryManager recoveryManager,
                         WebhookNotifier webhookNotifier,
                         TestRunner runner,
                         MeterRegistry meterRegistry) {
        this.properties = properties;
        this.registry = registry;
        this.matcher = matcher;
        this.timeoutManager = timeoutManager;
        this.statusTracker = statusTracker;
        this.recoveryManager = recoveryManager;
        this.webhookNotifier = webhookNotifier;
        this.runner = runner;

        registry.addChangeListener(this::wake);

        Gauge.builder("crucible.queue.pending", () -> snapshot().getPendingJobs())
            .description("Jobs waiting for an environment")
            .register(meterRegistry);

        Gauge.builder("crucible.queue.running", () -> snapshot().getRunningJobs())
            .description("Jobs currently executing")
            .register(meterRegistry);
    }

    /**
     * Start the admission loop
     *
     * @return false if it was already running
     */
    public boolean start() {
        lock.lock();
        try {
            if (running) {
                return false;
            }
            running = true;
            workers = Executors.newCachedThreadPool(new CustomizableThreadFactory("crucible-job-"));
            admissionThread = new CustomizableThreadFactory("crucible-admission-").newThread(this::admissionLoop);
            admissionThread.start();
        } finally {
            lock.unlock();
        }
        log.info("Job dispatcher started (max concurrent tests {}, poll interval {})",
            properties.getScheduler().getMaxConcurrentTests(), properties.getScheduler().getPollInterval());
        return true;
    }

    /**
     * Stop admitting work, wait up to the drain timeout for running jobs, then
     * cancel whatever is still running or pending.
     *
     * @return false if it was not running
     */
    public boolean stop() {
        Thread admission;
        lock.lock();
        try {
            if (!running) {
                return false;
            }
            running = false;
            admission = admissionThread;
            admissionThread = null;
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }

        try {
            admission.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        awaitDrain(properties.getScheduler().getShutdownDrainTimeout());

        List<Job> interrupted = new ArrayList<>();
        List<Future<?>> futures = new ArrayList<>();
        int cancelledPending;
        lock.lock();
        try {
            List<Job> queued = pending.drain();
            cancelledPending = queued.size();
            for (Job job : queued) {
                finish(job, JobStatus.CANCELLED, cancellationResult(job, "Orchestrator stopped"));
            }
            for (Job job : new ArrayList<>(jobs.values())) {
                if (job.getStatus() == JobStatus.RUNNING) {
                    Future<?> future = executions.get(job.getJobId());
                    if (future != null) {
                        futures.add(future);
                    }
                    finish(job, JobStatus.CANCELLED, cancellationResult(job, "Orchestrator stopped"));
                    interrupted.add(job);
                }
            }
        } finally {
            lock.unlock();
        }

        for (Job job : interrupted) {
            terminateQuietly(job.getJobId());
        }
        futures.forEach(future -> future.cancel(true));
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Some job worker threads did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        log.info("Job dispatcher stopped: cancelled {} pending and {} running jobs",
            cancelledPending, interrupted.size());
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Submit a test case for execution
     *
     * @return job identifier
     */
    public String submit(TestCase testCase, Priority priority, double impactScore) {
        return submit(JobRequest.builder()
            .testCase(testCase)
            .priority(priority)
            .impactScore(impactScore)
            .build());
    }

    /**
     * Submit a job request. The job is queued immediately, admission happens
     * asynchronously.
     *
     * @return job identifier
     * @throws IllegalArgumentException if the request is invalid
     */
    public String submit(JobRequest request) {
        validate(request);

        Job job = Job.builder()
            .jobId("job-" + UUID.randomUUID())
            .testCase(request.getTestCase())
            .priority(request.getPriority())
            .impactScore(request.getImpactScore())
            .planId(request.getPlanId())
            .notifications(request.getNotifications())
            .dependencies(request.getDependencies() != null ? List.copyOf(request.getDependencies()) : List.of())
            .sequence(sequence.incrementAndGet())
            .submittedAt(Instant.now())
            .status(JobStatus.PENDING)
            .build();

        lock.lock();
        try {
            for (String dependency : job.getDependencies()) {
                if (!jobs.containsKey(dependency)) {
                    throw new IllegalArgumentException("Unknown dependency: " + dependency);
                }
            }
            jobs.put(job.getJobId(), job);
            pending.enqueue(job);
            peakPending = Math.max(peakPending, pending.size());
            statusTracker.recordSubmitted(job.getJobId(), job.getPlanId());
            log.info("Job {} submitted: test={}, priority={}, impact={}, dependencies={}",
                job.getJobId(), job.getTestCase().getName(), job.getPriority(), job.getImpactScore(),
                job.getDependencies());

            Optional<Job> failedDependency = failedDependency(job);
            if (failedDependency.isPresent()) {
                pending.remove(job);
                finish(job, JobStatus.CANCELLED, dependencyFailedResult(job, failedDependency.get()));
            }
            signalWakeup();
        } finally {
            lock.unlock();
        }
        return job.getJobId();
    }

    private void validate(JobRequest request) {
        if (request == null || request.getTestCase() == null) {
            throw new IllegalArgumentException("Test case is required");
        }
        if (request.getPriority() == null) {
            throw new IllegalArgumentException("Priority is required");
        }
        if (request.getTestCase().getEstimatedDurationSeconds() <= 0) {
            throw new IllegalArgumentException("Estimated duration must be positive");
        }
        if (request.getDependencies() != null && request.getDependencies().contains(null)) {
            throw new IllegalArgumentException("Dependency ids must not be null");
        }
        double impact = request.getImpactScore();
        if (Double.isNaN(impact) || impact < 0.0 || impact > 1.0) {
            throw new IllegalArgumentException("Impact score must be between 0.0 and 1.0");
        }
    }

    /**
     * Copy of a job's current state
     */
    public Optional<Job> getJob(String jobId) {
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            return job != null ? Optional.of(copyOf(job)) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public QueueSnapshot snapshot() {
        lock.lock();
        try {
            PoolSnapshot pool = registry.snapshot();
            return QueueSnapshot.builder()
                .runningJobs(runningCount)
                .pendingJobs(pending.size())
                .availableEnvironments(pool.getAvailable())
                .allocatedEnvironments(pool.getAllocated())
                .totalEnvironments(pool.getTotal())
                .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancel a pending or running job
     *
     * @return copy of the cancelled job
     * @throws JobNotFoundException if the job is unknown
     * @throws IllegalStateException if the job already finished
     */
    public Job cancel(String jobId) {
        Future<?> future = null;
        boolean wasRunning;
        Job cancelled;
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            if (job == null) {
                throw new JobNotFoundException(jobId);
            }
            if (job.getStatus().isTerminal()) {
                throw new IllegalStateException("Job " + jobId + " already finished with status " + job.getStatus());
            }
            wasRunning = job.getStatus() == JobStatus.RUNNING;
            if (wasRunning) {
                future = executions.get(jobId);
            } else {
                pending.remove(job);
            }
            finish(job, JobStatus.CANCELLED, cancellationResult(job, "Cancelled by request"));
            cancelled = copyOf(job);
        } finally {
            lock.unlock();
        }

        if (wasRunning) {
            terminateQuietly(jobId);
            if (future != null) {
                future.cancel(true);
            }
        }
        log.info("Job {} cancelled", jobId);
        return cancelled;
    }

    /**
     * Remove an environment from the pool. A job running on it keeps running.
     */
    public RemovalOutcome removeEnvironment(String environmentId) {
        return registry.deregister(environmentId);
    }

    /**
     * An environment failed underneath its job: drop it from the pool and
     * resolve the job as failed, or re-queue it when retries remain.
     *
     * @return the affected job id, empty if the environment was idle
     */
    public Optional<String> environmentFailed(String environmentId, String reason) {
        String affectedJob = null;
        Job requeued = null;
        Future<?> future = null;
        lock.lock();
        try {
            Optional<String> holder = registry.get(environmentId).map(status -> status.getAllocatedTo());
            RemovalOutcome outcome = registry.deregister(environmentId);
            if (outcome == RemovalOutcome.NOT_FOUND) {
                throw new IllegalArgumentException("Unknown environment: " + environmentId);
            }
            if (holder.isPresent()) {
                Job job = jobs.get(holder.get());
                if (job != null && job.getStatus() == JobStatus.RUNNING) {
                    affectedJob = job.getJobId();
                    future = executions.get(affectedJob);
                    String message = "Environment " + environmentId + " lost: " + reason;
                    JobResult result = failureResult(job, message);
                    failOrRetry(job, result, message);
                    if (job.getStatus() == JobStatus.PENDING) {
                        // held back until the old attempt's process is gone, terminate is keyed by job id
                        job.setAwaitingTermination(true);
                        requeued = job;
                    }
                }
            }
        } finally {
            lock.unlock();
        }

        recoveryManager.report(ErrorCategory.ENVIRONMENT_FAILURE, ErrorSeverity.HIGH, COMPONENT,
            "Environment " + environmentId + " failed: " + reason, affectedJob, environmentId);

        if (affectedJob != null) {
            try {
                terminateQuietly(affectedJob);
                if (future != null) {
                    future.cancel(true);
                }
            } finally {
                if (requeued != null) {
                    releaseForAdmission(requeued);
                }
            }
        }
        return Optional.ofNullable(affectedJob);
    }

    private void releaseForAdmission(Job job) {
        lock.lock();
        try {
            job.setAwaitingTermination(false);
            signalWakeup();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wake the admission loop before its next poll
     */
    public void wake() {
        lock.lock();
        try {
            signalWakeup();
        } finally {
            lock.unlock();
        }
    }

    private void signalWakeup() {
        wakeRequested = true;
        wakeup.signalAll();
    }

    private void admissionLoop() {
        log.info("Admission loop started");
        while (running) {
            try {
                int admitted = admitPending();
                if (admitted > 0) {
                    log.debug("Admitted {} jobs", admitted);
                }
                recoveryManager.componentRecovered(COMPONENT);
            } catch (Exception e) {
                log.error("Error in admission loop", e);
                recoveryManager.componentFailed(COMPONENT, e);
            }
            awaitWakeup();
        }
        log.info("Admission loop stopped");
    }

    private void awaitWakeup() {
        lock.lock();
        try {
            long nanos = properties.getScheduler().getPollInterval().toNanos();
            while (running && !wakeRequested && nanos > 0) {
                nanos = wakeup.awaitNanos(nanos);
            }
            wakeRequested = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run one admission pass over the pending queue
     *
     * @return number of jobs started
     */
    int admitPending() {
        int admitted = 0;
        List<Job> unplaceable = new ArrayList<>();
        lock.lock();
        try {
            if (!running || pending.isEmpty()) {
                return 0;
            }
            int maxConcurrent = properties.getScheduler().getMaxConcurrentTests();
            Instant now = Instant.now();
            boolean blockedByHardware = false;
            List<EnvironmentStatus> pool = null;

            Iterator<Job> it = pending.iterator();
            while (it.hasNext() && runningCount < maxConcurrent) {
                Job job = it.next();
                if (job.isBackingOff(now) || job.isAwaitingTermination() || !dependenciesCompleted(job)) {
                    continue;
                }
                TestCase testCase = job.getTestCase();
                Optional<Environment> environment = registry.allocate(job.getJobId(),
                    candidates -> matcher.findMatch(testCase.getRequiredHardware(), testCase.estimatedDuration(), candidates));
                if (environment.isEmpty()) {
                    blockedByHardware = true;
                    if (!exhaustionReported.contains(job.getJobId())) {
                        if (pool == null) {
                            pool = registry.list();
                        }
                        if (!matcher.isSatisfiable(testCase.getRequiredHardware(), pool)) {
                            exhaustionReported.add(job.getJobId());
                            unplaceable.add(copyOf(job));
                        }
                    }
                    continue;
                }
                it.remove();
                launch(job, environment.get());
                admitted++;
            }

            if (blockedByHardware && log.isDebugEnabled()) {
                log.debug("{} jobs waiting for a compatible environment ({})", pending.size(), registry.getPoolSummary());
            }
        } finally {
            lock.unlock();
        }

        for (Job job : unplaceable) {
            recoveryManager.report(ErrorCategory.RESOURCE_EXHAUSTION, ErrorSeverity.MEDIUM, COMPONENT,
                "No registered environment can run job " + job.getJobId() + " (" + job.getTestCase().getName() + ")",
                job.getJobId(), null);
        }
        return admitted;
    }

    /**
     * Whether a pending job is waiting for hardware no registered environment has
     */
    public boolean isPlacementBlocked(String jobId) {
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            if (job == null || job.getStatus() != JobStatus.PENDING) {
                return false;
            }
            return !matcher.isSatisfiable(job.getTestCase().getRequiredHardware(), registry.list());
        } finally {
            lock.unlock();
        }
    }

    private boolean dependenciesCompleted(Job job) {
        for (String dependency : job.getDependencies()) {
            Job required = jobs.get(dependency);
            if (required != null && required.getStatus() != JobStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private Optional<Job> failedDependency(Job job) {
        for (String dependency : job.getDependencies()) {
            Job required = jobs.get(dependency);
            if (required != null && required.getStatus().isTerminal() && required.getStatus() != JobStatus.COMPLETED) {
                return Optional.of(required);
            }
        }
        return Optional.empty();
    }

    private void launch(Job job, Environment environment) {
        job.setStatus(JobStatus.RUNNING);
        job.setEnvironmentId(environment.getId());
        job.setStartedAt(Instant.now());
        job.setNotBefore(null);
        exhaustionReported.remove(job.getJobId());
        job.setDeadline(timeoutManager.register(job.getJobId(), job.getTestCase().estimatedDuration()));
        runningCount++;
        peakRunning = Math.max(peakRunning, runningCount);
        statusTracker.record(job.getJobId(), JobStatus.PENDING, JobStatus.RUNNING,
            "environment " + environment.getId(), null);

        int attempt = job.getAttempt();
        try {
            executions.put(job.getJobId(), workers.submit(() -> execute(job, environment, attempt)));
        } catch (RejectedExecutionException e) {
            log.error("Could not start worker for job {}", job.getJobId(), e);
            finish(job, JobStatus.FAILED, failureResult(job, "Worker rejected: " + e.getMessage()));
        }
    }

    private void execute(Job job, Environment environment, int attempt) {
        long startTime = System.nanoTime();
        try {
            RunnerOutput output = runner.execute(job.getJobId(), job.getTestCase(), environment);
            onRunnerFinished(job, attempt, output, null, Duration.ofNanos(System.nanoTime() - startTime));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            onRunnerFinished(job, attempt, null, e, Duration.ofNanos(System.nanoTime() - startTime));
        } catch (Exception e) {
            onRunnerFinished(job, attempt, null, e, Duration.ofNanos(System.nanoTime() - startTime));
        }
    }

    private void onRunnerFinished(Job job, int attempt, RunnerOutput output, Exception error, Duration elapsed) {
        if (error != null) {
            onRunnerError(job, attempt, error);
            return;
        }
        lock.lock();
        try {
            if (job.getStatus() != JobStatus.RUNNING || job.getAttempt() != attempt) {
                log.debug("Ignoring runner result for job {}, already {}", job.getJobId(), job.getStatus());
                return;
            }

            Duration executionTime = output.getDuration() != null ? output.getDuration() : elapsed;
            if (output.getExitCode() == 0) {
                finish(job, JobStatus.COMPLETED, JobResult.builder()
                    .jobId(job.getJobId())
                    .status(JobStatus.COMPLETED)
                    .executionTime(executionTime)
                    .environmentId(job.getEnvironmentId())
                    .stdout(output.getStdout())
                    .stderr(output.getStderr())
                    .exitCode(0)
                    .kernelPanic(output.isKernelPanic())
                    .completedAt(Instant.now())
                    .build());
                return;
            }

            String message = "Exit code " + output.getExitCode();
            JobResult result = JobResult.builder()
                .jobId(job.getJobId())
                .status(JobStatus.FAILED)
                .executionTime(executionTime)
                .environmentId(job.getEnvironmentId())
                .stdout(output.getStdout())
                .stderr(output.getStderr())
                .exitCode(output.getExitCode())
                .errorMessage(message)
                .kernelPanic(output.isKernelPanic())
                .completedAt(Instant.now())
                .build();
            if (output.isKernelPanic()) {
                escalateSubsystem(job.getTestCase().getTargetSubsystem());
            }
            failOrRetry(job, result, message);
        } finally {
            lock.unlock();
        }
    }

    private void onRunnerError(Job job, int attempt, Exception error) {
        String message = "Runner error: " + (error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        String environmentId;
        lock.lock();
        try {
            if (job.getStatus() != JobStatus.RUNNING || job.getAttempt() != attempt) {
                log.debug("Ignoring runner error for job {}, already {}", job.getJobId(), job.getStatus());
                return;
            }
            environmentId = job.getEnvironmentId();
            log.error("Job {} runner failed: {}", job.getJobId(), message);
            failOrRetry(job, failureResult(job, message), message);
        } finally {
            lock.unlock();
        }
        recoveryManager.report(ErrorCategory.TEST_EXECUTION, ErrorSeverity.MEDIUM, COMPONENT,
            "Job " + job.getJobId() + " " + message, job.getJobId(), environmentId);
    }

    /**
     * Handle an expired deadline: mark TIMEOUT with partial output, release, then
     * terminate. The status changes first so the terminated runner's exit is ignored.
     */
    public void onDeadlineExpired(String jobId) {
        Future<?> future;
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            if (job == null || job.getStatus() != JobStatus.RUNNING) {
                return;
            }
            String partialOutput = partialOutputQuietly(jobId);
            future = executions.get(jobId);
            Duration budget = Duration.between(job.getStartedAt(), job.getDeadline());
            JobResult result = JobResult.builder()
                .jobId(jobId)
                .status(JobStatus.TIMEOUT)
                .executionTime(Duration.between(job.getStartedAt(), Instant.now()))
                .environmentId(job.getEnvironmentId())
                .stdout(partialOutput)
                .stderr("")
                .errorMessage("Timed out after " + budget.toMillis() + "ms")
                .completedAt(Instant.now())
                .build();
            finish(job, JobStatus.TIMEOUT, result);
        } finally {
            lock.unlock();
        }

        terminateQuietly(jobId);
        if (future != null) {
            future.cancel(true);
        }
        recoveryManager.report(ErrorCategory.TIMEOUT, ErrorSeverity.LOW, COMPONENT,
            "Job " + jobId + " timed out", jobId, null);
    }

    private void failOrRetry(Job job, JobResult result, String message) {
        RetryPolicy retryPolicy = properties.getRetry();
        if (!retryPolicy.allowsRetry(job.getAttempt())) {
            finish(job, JobStatus.FAILED, result);
            return;
        }

        Duration backoff = retryPolicy.backoff(job.getAttempt());
        String environmentId = job.getEnvironmentId();
        timeoutManager.unregister(job.getJobId());
        executions.remove(job.getJobId());
        runningCount--;

        job.setAttempt(job.getAttempt() + 1);
        job.setStatus(JobStatus.PENDING);
        job.setEnvironmentId(null);
        job.setStartedAt(null);
        job.setDeadline(null);
        job.setLastError(message);
        job.setNotBefore(Instant.now().plus(backoff));
        pending.enqueue(job);

        registry.release(environmentId, job.getJobId());
        statusTracker.record(job.getJobId(), JobStatus.RUNNING, JobStatus.PENDING,
            "retry " + job.getAttempt() + "/" + retryPolicy.getMaxRetries() + " after: " + message, null);
        log.info("Retrying job {} (attempt {}/{}) in {}ms", job.getJobId(), job.getAttempt(),
            retryPolicy.getMaxRetries(), backoff.toMillis());
        signalWakeup();
        idle.signalAll();
    }

    /**
     * Single terminal transition. Caller holds the lock and has removed a
     * PENDING job from the queue.
     */
    private void finish(Job job, JobStatus status, JobResult result) {
        JobStatus previous = job.getStatus();
        if (previous.isTerminal()) {
            log.warn("Job {} already finished with {}, ignoring {}", job.getJobId(), previous, status);
            return;
        }

        String environmentId = job.getEnvironmentId();
        timeoutManager.unregister(job.getJobId());
        executions.remove(job.getJobId());
        if (previous == JobStatus.RUNNING) {
            runningCount--;
        }

        job.setStatus(status);
        job.setEnvironmentId(null);
        job.setResult(result);
        job.setFinishedAt(Instant.now());
        exhaustionReported.remove(job.getJobId());
        totalProcessed++;

        if (environmentId != null) {
            registry.release(environmentId, job.getJobId());
        }

        Duration executionTime = previous == JobStatus.RUNNING && result != null ? result.getExecutionTime() : null;
        statusTracker.record(job.getJobId(), previous, status,
            result != null ? result.getErrorMessage() : null, executionTime);
        webhookNotifier.notifyTerminal(job);

        if (status != JobStatus.COMPLETED) {
            cancelDependents(job);
        }
        signalWakeup();
        idle.signalAll();
    }

    private void cancelDependents(Job failed) {
        List<Job> dependents = new ArrayList<>();
        for (Job candidate : pending) {
            if (candidate.dependsOn(failed.getJobId())) {
                dependents.add(candidate);
            }
        }
        for (Job dependent : dependents) {
            pending.remove(dependent);
            log.info("Cancelling job {}: dependency {} ended {}", dependent.getJobId(), failed.getJobId(), failed.getStatus());
            finish(dependent, JobStatus.CANCELLED, dependencyFailedResult(dependent, failed));
        }
    }

    /**
     * Raise pending jobs of a subsystem to HIGH, keeping their submission order
     */
    private void escalateSubsystem(String subsystem) {
        if (subsystem == null) {
            return;
        }
        List<Job> escalated = new ArrayList<>();
        Iterator<Job> it = pending.iterator();
        while (it.hasNext()) {
            Job job = it.next();
            if (subsystem.equals(job.getTestCase().getTargetSubsystem()) && Priority.HIGH.isHigherThan(job.getPriority())) {
                it.remove();
                escalated.add(job);
            }
        }
        for (Job job : escalated) {
            job.setPriority(Priority.HIGH);
            pending.enqueue(job);
        }
        if (!escalated.isEmpty()) {
            log.warn("Kernel panic in subsystem {}: escalated {} pending jobs to HIGH", subsystem, escalated.size());
        }
    }

    private void awaitDrain(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return;
        }
        lock.lock();
        try {
            long nanos = timeout.toNanos();
            while (runningCount > 0 && nanos > 0) {
                nanos = idle.awaitNanos(nanos);
            }
            if (runningCount > 0) {
                log.warn("{} jobs still running after drain timeout {}", runningCount, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop finished jobs older than the retention period
     *
     * @return number of jobs removed
     */
    public int purgeFinished(Duration retention) {
        Instant cutoff = Instant.now().minus(retention);
        lock.lock();
        try {
            Set<String> awaited = new HashSet<>();
            for (Job job : pending) {
                awaited.addAll(job.getDependencies());
            }
            int before = jobs.size();
            jobs.values().removeIf(job -> job.getStatus().isTerminal()
                && job.getFinishedAt() != null && job.getFinishedAt().isBefore(cutoff)
                && !awaited.contains(job.getJobId()));
            int removed = before - jobs.size();
            if (removed > 0) {
                log.info("Purged {} finished jobs older than {}", removed, retention);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copies of jobs that are pending or running, in admission order
     */
    public List<Job> activeJobs() {
        lock.lock();
        try {
            List<Job> active = new ArrayList<>();
            for (Job job : jobs.values()) {
                if (job.getStatus() == JobStatus.RUNNING) {
                    active.add(copyOf(job));
                }
            }
            for (Job job : pending) {
                active.add(copyOf(job));
            }
            active.sort(Job.ADMISSION_ORDER);
            return active;
        } finally {
            lock.unlock();
        }
    }

    public int getPeakRunning() {
        lock.lock();
        try {
            return peakRunning;
        } finally {
            lock.unlock();
        }
    }

    public int getPeakPending() {
        lock.lock();
        try {
            return peakPending;
        } finally {
            lock.unlock();
        }
    }

    public long getTotalProcessed() {
        lock.lock();
        try {
            return totalProcessed;
        } finally {
            lock.unlock();
        }
    }

    public ComponentHealth health() {
        QueueSnapshot snapshot = snapshot();
        ComponentHealth.ComponentHealthBuilder builder = ComponentHealth.builder()
            .component(COMPONENT)
            .detail("runningJobs", snapshot.getRunningJobs())
            .detail("pendingJobs", snapshot.getPendingJobs())
            .detail("maxConcurrentTests", properties.getScheduler().getMaxConcurrentTests());
        if (!running) {
            return builder.state(HealthState.STOPPED).build();
        }
        if (admissionThread == null || !admissionThread.isAlive()) {
            return builder.state(HealthState.DEGRADED).message("Admission loop not alive").build();
        }
        String failure = recoveryManager.componentFailure(COMPONENT);
        if (failure != null) {
            return builder.state(HealthState.DEGRADED).message(failure).build();
        }
        return builder.state(HealthState.HEALTHY).build();
    }

    private JobResult cancellationResult(Job job, String message) {
        Duration executionTime = job.getStartedAt() != null
            ? Duration.between(job.getStartedAt(), Instant.now())
            : Duration.ZERO;
        return JobResult.builder()
            .jobId(job.getJobId())
            .status(JobStatus.CANCELLED)
            .executionTime(executionTime)
            .environmentId(job.getEnvironmentId())
            .errorMessage(message)
            .completedAt(Instant.now())
            .build();
    }

    private JobResult dependencyFailedResult(Job job, Job dependency) {
        return cancellationResult(job, "Dependency " + dependency.getJobId() + " ended " + dependency.getStatus());
    }

    private JobResult failureResult(Job job, String message) {
        Duration executionTime = job.getStartedAt() != null
            ? Duration.between(job.getStartedAt(), Instant.now())
            : Duration.ZERO;
        return JobResult.builder()
            .jobId(job.getJobId())
            .status(JobStatus.FAILED)
            .executionTime(executionTime)
            .environmentId(job.getEnvironmentId())
            .errorMessage(message)
            .completedAt(Instant.now())
            .build();
    }

    private void terminateQuietly(String jobId) {
        try {
            runner.terminate(jobId);
        } catch (Exception e) {
            log.error("Failed to terminate job {}", jobId, e);
        }
    }

    private String partialOutputQuietly(String jobId) {
        try {
            String output = runner.partialOutput(jobId);
            return output != null ? output : "";
        } catch (Exception e) {
            log.warn("Could not collect partial output of job {}: {}", jobId, e.getMessage());
            return "";
        }
    }

    private static Job copyOf(Job job) {
        return job.toBuilder().build();
    }
}
