package com.whereq.crucible.service;

import com.whereq.crucible.exception.JobNotFoundException;
import com.whereq.crucible.model.BackendKind;
import com.whereq.crucible.model.Job;
import com.whereq.crucible.model.JobRequest;
import com.whereq.crucible.model.JobStatus;
import com.whereq.crucible.model.Priority;
import com.whereq.crucible.model.StatusTransition;
import com.whereq.crucible.model.TestCase;
import com.whereq.crucible.recovery.ErrorCategory;
import com.whereq.crucible.resource.RemovalOutcome;
import com.whereq.crucible.support.OrchestratorHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.whereq.crucible.support.TestFixtures.environment;
import static com.whereq.crucible.support.TestFixtures.requirement;
import static com.whereq.crucible.support.TestFixtures.testCase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class JobDispatcherTest {

    private OrchestratorHarness harness;
    private JobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        harness = new OrchestratorHarness();
        dispatcher = harness.dispatcher;
    }

    @AfterEach
    void tearDown() {
        harness.shutdown();
    }

    private JobStatus statusOf(String jobId) {
        return dispatcher.getJob(jobId).map(Job::getStatus).orElse(null);
    }

    private void awaitStatus(String jobId, JobStatus status) {
        await().atMost(Duration.ofSeconds(10)).until(() -> statusOf(jobId) == status);
    }

    private long errorsOf(ErrorCategory category) {
        return harness.recoveryManager.recentErrors().stream()
            .filter(event -> event.getCategory() == category)
            .count();
    }

    private String submitAfter(String name, String script, Priority priority, String... dependencies) {
        return dispatcher.submit(JobRequest.builder()
            .testCase(testCase(name, script))
            .priority(priority)
            .dependencies(List.of(dependencies))
            .build());
    }

    private static TestCase inSubsystem(TestCase testCase, String subsystem) {
        testCase.setTargetSubsystem(subsystem);
        return testCase;
    }

    @Test
    void criticalJobRunsBeforeEarlierLowJob() {
        harness.withEnvironments(environment("env-1"));
        String low = dispatcher.submit(testCase("low", "sleep 50"), Priority.LOW, 0.9);
        String critical = dispatcher.submit(testCase("critical", "sleep 50"), Priority.CRITICAL, 0.1);

        dispatcher.start();

        awaitStatus(low, JobStatus.COMPLETED);
        assertThat(statusOf(critical)).isEqualTo(JobStatus.COMPLETED);
        assertThat(harness.runner.getStartOrder()).containsExactly("critical", "low");
    }

    @Test
    void equalPriorityRunsInSubmissionOrder() {
        harness.withEnvironments(environment("env-1"));
        List<String> jobIds = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            jobIds.add(dispatcher.submit(testCase("t" + i, "sleep 10"), Priority.MEDIUM, 0.5));
        }

        dispatcher.start();

        jobIds.forEach(jobId -> awaitStatus(jobId, JobStatus.COMPLETED));
        assertThat(harness.runner.getStartOrder()).containsExactly("t0", "t1", "t2", "t3");
    }

    @Test
    void twoEnvironmentsRunTwoJobsAndQueueTheRest() {
        harness.withEnvironments(environment("env-1"), environment("env-2"));
        dispatcher.start();

        List<String> jobIds = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            jobIds.add(dispatcher.submit(testCase("t" + i, "sleep 400"), Priority.MEDIUM, 0.5));
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> dispatcher.snapshot().getRunningJobs() == 2
            && dispatcher.snapshot().getPendingJobs() == 3);

        jobIds.forEach(jobId -> awaitStatus(jobId, JobStatus.COMPLETED));
        assertThat(dispatcher.getPeakRunning()).isEqualTo(2);
        assertThat(harness.runner.getPeakConcurrency()).isEqualTo(2);
        assertThat(dispatcher.getTotalProcessed()).isEqualTo(5);
        assertThat(harness.registry.snapshot().getAllocated()).isZero();
    }

    @Test
    void loadOfThreeJobsPerEnvironmentCompletes() {
        harness.withEnvironments(environment("env-1"), environment("env-2", BackendKind.CONTAINER, "x86_64", 4096),
            environment("env-3", BackendKind.PHYSICAL, "x86_64", 4096));
        dispatcher.start();

        List<String> jobIds = new ArrayList<>();
        Priority[] priorities = Priority.values();
        for (int i = 0; i < 9; i++) {
            jobIds.add(dispatcher.submit(testCase("load-" + i, "sleep 100"), priorities[i % priorities.length], 0.5));
        }

        jobIds.forEach(jobId -> awaitStatus(jobId, JobStatus.COMPLETED));
        assertThat(harness.runner.getPeakConcurrency()).isLessThanOrEqualTo(3);
        assertThat(dispatcher.snapshot().getRunningJobs()).isZero();
        assertThat(dispatcher.snapshot().getPendingJobs()).isZero();
        assertThat(harness.statusTracker.metrics().getCompletedTests()).isEqualTo(9);
    }

    @Test
    void concurrencyIsBoundedByMaxConcurrentTests() {
        harness.properties.getScheduler().setMaxConcurrentTests(2);
        for (int i = 0; i < 5; i++) {
            harness.registry.register(environment("env-" + i));
        }
        dispatcher.start();

        List<String> jobIds = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            jobIds.add(dispatcher.submit(testCase("t" + i, "sleep 150"), Priority.HIGH, 0.5));
        }

        jobIds.forEach(jobId -> awaitStatus(jobId, JobStatus.COMPLETED));
        assertThat(dispatcher.getPeakRunning()).isEqualTo(2);
        assertThat(harness.runner.getPeakConcurrency()).isLessThanOrEqualTo(2);
    }

    @Test
    void incompatibleJobDoesNotBlockOthers() {
        harness.withEnvironments(environment("env-1"));
        String arm = dispatcher.submit(testCase("arm", "sleep 10", 1, requirement("arm64", 512)), Priority.CRITICAL, 0.5);
        String x86 = dispatcher.submit(testCase("x86", "sleep 10"), Priority.LOW, 0.5);

        dispatcher.start();

        awaitStatus(x86, JobStatus.COMPLETED);
        assertThat(statusOf(arm)).isEqualTo(JobStatus.PENDING);
        assertThat(dispatcher.activeJobs()).extracting(Job::getJobId).containsExactly(arm);
        assertThat(dispatcher.isPlacementBlocked(arm)).isTrue();
        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2))
            .until(() -> errorsOf(ErrorCategory.RESOURCE_EXHAUSTION) == 1);

        harness.registry.register(environment("arm-1", BackendKind.EMULATOR, "arm64", 2048));
        assertThat(dispatcher.isPlacementBlocked(arm)).isFalse();
        awaitStatus(arm, JobStatus.COMPLETED);
    }

    @Test
    void timedOutJobIsTerminatedAndReleasesEnvironment() {
        harness.properties.getScheduler().setDefaultTimeout(Duration.ofMillis(300));
        harness.timeoutManager.start(dispatcher::onDeadlineExpired);
        harness.withEnvironments(environment("env-1"));
        dispatcher.start();

        String jobId = dispatcher.submit(testCase("stuck", "echo booting; hang"), Priority.MEDIUM, 0.5);

        awaitStatus(jobId, JobStatus.TIMEOUT);
        Job job = dispatcher.getJob(jobId).orElseThrow();
        assertThat(job.getResult().getStdout()).contains("booting");
        assertThat(job.getResult().getErrorMessage()).startsWith("Timed out");
        assertThat(job.getEnvironmentId()).isNull();
        assertThat(harness.runner.getTerminated()).contains(jobId);
        assertThat(harness.registry.get("env-1").orElseThrow().isIdle()).isTrue();
        assertThat(harness.statusTracker.metrics().getTimedOutTests()).isEqualTo(1);
    }

    @Test
    void overrunningJobsAllEndTimedOut() {
        harness.properties.getScheduler().setDefaultTimeout(Duration.ofMillis(300));
        harness.properties.getRetry().setMaxRetries(2);
        harness.timeoutManager.start(dispatcher::onDeadlineExpired);
        for (int i = 0; i < 8; i++) {
            harness.registry.register(environment("env-" + i));
        }
        dispatcher.start();

        List<String> jobIds = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            jobIds.add(dispatcher.submit(testCase("overrun-" + i, "echo booting; hang"), Priority.MEDIUM, 0.5));
        }

        jobIds.forEach(jobId -> awaitStatus(jobId, JobStatus.TIMEOUT));
        for (String jobId : jobIds) {
            Job job = dispatcher.getJob(jobId).orElseThrow();
            assertThat(job.getAttempt()).isZero();
            assertThat(job.getResult().getStdout()).contains("booting");
            assertThat(job.getResult().getErrorMessage()).startsWith("Timed out");
        }
        assertThat(harness.runner.getTerminated()).containsAll(jobIds);
        assertThat(harness.statusTracker.metrics().getTimedOutTests()).isEqualTo(8);
        assertThat(harness.statusTracker.metrics().getFailedTests()).isZero();
        await().atMost(Duration.ofSeconds(2)).until(() -> harness.registry.snapshot().getAllocated() == 0);
    }

    @Test
    void removedEnvironmentFinishesItsJobThenLeavesPool() {
        harness.withEnvironments(environment("env-1"));
        dispatcher.start();
        String first = dispatcher.submit(testCase("first", "sleep 300"), Priority.MEDIUM, 0.5);
        awaitStatus(first, JobStatus.RUNNING);

        assertThat(dispatcher.removeEnvironment("env-1")).isEqualTo(RemovalOutcome.RETIRED);
        String second = dispatcher.submit(testCase("second", "sleep 10"), Priority.CRITICAL, 0.5);

        awaitStatus(first, JobStatus.COMPLETED);
        assertThat(harness.registry.list()).isEmpty();
        assertThat(statusOf(second)).isEqualTo(JobStatus.PENDING);

        harness.registry.register(environment("env-2"));
        awaitStatus(second, JobStatus.COMPLETED);
    }

    @Test
    void environmentFailureFailsItsJob() {
        harness.withEnvironments(environment("env-1"), environment("env-2"));
        dispatcher.start();
        String jobId = dispatcher.submit(testCase("victim", "hang"), Priority.MEDIUM, 0.5);
        awaitStatus(jobId, JobStatus.RUNNING);
        String environmentId = dispatcher.getJob(jobId).orElseThrow().getEnvironmentId();

        assertThat(dispatcher.environmentFailed(environmentId, "qemu crashed")).contains(jobId);

        Job job = dispatcher.getJob(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getResult().getErrorMessage()).contains("qemu crashed");
        assertThat(harness.registry.get(environmentId)).isEmpty();
        assertThat(harness.registry.list()).hasSize(1);
        assertThat(harness.runner.getTerminated()).contains(jobId);
        assertThat(harness.recoveryManager.isDegraded()).isTrue();
    }

    @Test
    void retriedJobSurvivesSlowTerminationOfFailedAttempt() {
        harness.properties.getRetry().setMaxRetries(1);
        harness.properties.getRetry().setInitialIntervalMs(1);
        harness.runner.setTerminateDelay(Duration.ofMillis(300));
        harness.withEnvironments(environment("env-1"), environment("env-2"));
        dispatcher.start();
        String jobId = dispatcher.submit(testCase("victim", "sleep 400"), Priority.MEDIUM, 0.5);
        awaitStatus(jobId, JobStatus.RUNNING);
        String lostEnvironment = dispatcher.getJob(jobId).orElseThrow().getEnvironmentId();

        assertThat(dispatcher.environmentFailed(lostEnvironment, "host lost")).contains(jobId);

        awaitStatus(jobId, JobStatus.COMPLETED);
        Job job = dispatcher.getJob(jobId).orElseThrow();
        assertThat(job.getAttempt()).isEqualTo(1);
        assertThat(job.getResult().getEnvironmentId()).isNotEqualTo(lostEnvironment);
        assertThat(harness.runner.getStartOrder()).containsExactly("victim", "victim");
        assertThat(harness.runner.getTerminated()).containsExactly(jobId);
    }

    @Test
    void idleEnvironmentFailureAffectsNoJob() {
        harness.withEnvironments(environment("env-1"));

        assertThat(dispatcher.environmentFailed("env-1", "disk gone")).isEmpty();
        assertThat(harness.registry.list()).isEmpty();
        assertThatThrownBy(() -> dispatcher.environmentFailed("env-1", "again"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancelPendingAndRunningJobs() {
        harness.withEnvironments(environment("env-1"));
        dispatcher.start();
        String running = dispatcher.submit(testCase("running", "hang"), Priority.MEDIUM, 0.5);
        awaitStatus(running, JobStatus.RUNNING);
        String pending = dispatcher.submit(testCase("pending", "sleep 10"), Priority.LOW, 0.5);

        Job cancelledPending = dispatcher.cancel(pending);
        assertThat(cancelledPending.getStatus()).isEqualTo(JobStatus.CANCELLED);

        Job cancelledRunning = dispatcher.cancel(running);
        assertThat(cancelledRunning.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(harness.runner.getTerminated()).contains(running);
        assertThat(harness.registry.get("env-1").orElseThrow().isIdle()).isTrue();
        assertThat(harness.runner.getStartOrder()).containsExactly("running");

        assertThatThrownBy(() -> dispatcher.cancel(running)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> dispatcher.cancel("job-missing")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void failingJobIsRetriedWithBackoff() {
        harness.properties.getRetry().setMaxRetries(2);
        harness.withEnvironments(environment("env-1"));
        dispatcher.start();

        String flaky = dispatcher.submit(testCase("flaky", "flaky 1; sleep 10"), Priority.MEDIUM, 0.5);
        String broken = dispatcher.submit(testCase("broken", "exit 3"), Priority.MEDIUM, 0.5);

        awaitStatus(flaky, JobStatus.COMPLETED);
        awaitStatus(broken, JobStatus.FAILED);

        assertThat(dispatcher.getJob(flaky).orElseThrow().getAttempt()).isEqualTo(1);
        Job failed = dispatcher.getJob(broken).orElseThrow();
        assertThat(failed.getAttempt()).isEqualTo(2);
        assertThat(failed.getResult().getExitCode()).isEqualTo(3);
        assertThat(harness.statusTracker.timeline(broken))
            .extracting(StatusTransition::getTo)
            .containsExactly(JobStatus.PENDING, JobStatus.RUNNING, JobStatus.PENDING, JobStatus.RUNNING,
                JobStatus.PENDING, JobStatus.RUNNING, JobStatus.FAILED);
    }

    @Test
    void runnerExceptionFailsJob() {
        harness.withEnvironments(environment("env-1"));
        dispatcher.start();

        String jobId = dispatcher.submit(testCase("explodes", "throw no such script"), Priority.MEDIUM, 0.5);

        awaitStatus(jobId, JobStatus.FAILED);
        assertThat(dispatcher.getJob(jobId).orElseThrow().getResult().getErrorMessage()).contains("no such script");
        assertThat(harness.registry.get("env-1").orElseThrow().isIdle()).isTrue();
        await().atMost(Duration.ofSeconds(2)).until(() -> errorsOf(ErrorCategory.TEST_EXECUTION) == 1);
        assertThat(harness.recoveryManager.recentErrors())
            .filteredOn(event -> event.getCategory() == ErrorCategory.TEST_EXECUTION)
            .singleElement()
            .satisfies(event -> assertThat(event.getJobId()).isEqualTo(jobId));
    }

    @Test
    void dependentJobWaitsForItsDependency() {
        harness.withEnvironments(environment("env-1"), environment("env-2"));
        String build = dispatcher.submit(testCase("build", "sleep 200"), Priority.LOW, 0.5);
        String boot = submitAfter("boot", "exit 0", Priority.CRITICAL, build);
        String smoke = dispatcher.submit(testCase("smoke", "exit 0"), Priority.MEDIUM, 0.5);

        dispatcher.start();

        awaitStatus(boot, JobStatus.COMPLETED);
        assertThat(statusOf(smoke)).isEqualTo(JobStatus.COMPLETED);
        Job finishedBuild = dispatcher.getJob(build).orElseThrow();
        Job finishedBoot = dispatcher.getJob(boot).orElseThrow();
        assertThat(finishedBuild.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(finishedBoot.getStartedAt()).isAfterOrEqualTo(finishedBuild.getFinishedAt());
        assertThat(finishedBoot.getDependencies()).containsExactly(build);
        assertThat(harness.runner.getStartOrder()).hasSize(3).endsWith("boot");
    }

    @Test
    void failedDependencyCancelsDependentsTransitively() {
        harness.withEnvironments(environment("env-1"));
        String compile = dispatcher.submit(testCase("compile", "exit 2"), Priority.MEDIUM, 0.5);
        String boot = submitAfter("boot", "exit 0", Priority.MEDIUM, compile);
        String ltp = submitAfter("ltp", "exit 0", Priority.HIGH, boot);

        dispatcher.start();

        awaitStatus(ltp, JobStatus.CANCELLED);
        assertThat(statusOf(compile)).isEqualTo(JobStatus.FAILED);
        assertThat(statusOf(boot)).isEqualTo(JobStatus.CANCELLED);
        assertThat(dispatcher.getJob(boot).orElseThrow().getResult().getErrorMessage())
            .contains(compile).contains("FAILED");
        assertThat(dispatcher.getJob(ltp).orElseThrow().getResult().getErrorMessage())
            .contains(boot).contains("CANCELLED");
        assertThat(harness.runner.getStartOrder()).containsExactly("compile");
        assertThat(dispatcher.snapshot().getPendingJobs()).isZero();
        assertThat(harness.statusTracker.metrics().getCancelledTests()).isEqualTo(2);
    }

    @Test
    void dependenciesAreCheckedAtSubmission() {
        assertThatThrownBy(() -> submitAfter("orphan", "exit 0", Priority.LOW, "job-missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("job-missing");

        String dropped = dispatcher.submit(testCase("dropped", "exit 0"), Priority.LOW, 0.5);
        dispatcher.cancel(dropped);
        String late = submitAfter("late", "exit 0", Priority.LOW, dropped);

        assertThat(statusOf(late)).isEqualTo(JobStatus.CANCELLED);
        assertThat(dispatcher.snapshot().getPendingJobs()).isZero();
    }

    @Test
    void purgeKeepsDependenciesOfWaitingJobs() {
        harness.withEnvironments(environment("env-1"));
        dispatcher.start();
        String firmware = dispatcher.submit(testCase("firmware", "exit 0"), Priority.MEDIUM, 0.5);
        awaitStatus(firmware, JobStatus.COMPLETED);
        String armBoot = dispatcher.submit(JobRequest.builder()
            .testCase(testCase("arm-boot", "exit 0", 1, requirement("arm64", 512)))
            .priority(Priority.MEDIUM)
            .dependencies(List.of(firmware))
            .build());

        assertThat(dispatcher.purgeFinished(Duration.ZERO.minusSeconds(1))).isZero();
        assertThat(dispatcher.getJob(firmware)).isPresent();

        dispatcher.cancel(armBoot);
        assertThat(dispatcher.purgeFinished(Duration.ZERO.minusSeconds(1))).isEqualTo(2);
    }

    @Test
    void kernelPanicEscalatesPendingJobsOfSameSubsystem() {
        harness.withEnvironments(environment("env-1"));
        String panic = dispatcher.submit(inSubsystem(testCase("panic", "panic; exit 1"), "mm"), Priority.CRITICAL, 0.5);
        dispatcher.submit(inSubsystem(testCase("net-medium", "sleep 10"), "net"), Priority.MEDIUM, 0.5);
        dispatcher.submit(inSubsystem(testCase("fs-low", "sleep 10"), "fs"), Priority.LOW, 0.5);
        String mmLow = dispatcher.submit(inSubsystem(testCase("mm-low", "sleep 10"), "mm"), Priority.LOW, 0.5);

        dispatcher.start();

        awaitStatus(mmLow, JobStatus.COMPLETED);
        await().atMost(Duration.ofSeconds(10)).until(() -> harness.runner.getStartOrder().size() == 4);
        assertThat(dispatcher.getJob(panic).orElseThrow().getResult().isKernelPanic()).isTrue();
        assertThat(dispatcher.getJob(mmLow).orElseThrow().getPriority()).isEqualTo(Priority.HIGH);
        assertThat(harness.runner.getStartOrder()).containsExactly("panic", "mm-low", "net-medium", "fs-low");
    }

    @Test
    void stopCancelsRunningAndPendingJobs() {
        harness.withEnvironments(environment("env-1"));
        dispatcher.start();
        String running = dispatcher.submit(testCase("running", "hang"), Priority.MEDIUM, 0.5);
        awaitStatus(running, JobStatus.RUNNING);
        String pending = dispatcher.submit(testCase("pending", "sleep 10"), Priority.MEDIUM, 0.5);

        assertThat(dispatcher.stop()).isTrue();
        assertThat(dispatcher.stop()).isFalse();

        assertThat(statusOf(running)).isEqualTo(JobStatus.CANCELLED);
        assertThat(statusOf(pending)).isEqualTo(JobStatus.CANCELLED);
        assertThat(dispatcher.snapshot().getRunningJobs()).isZero();
        assertThat(dispatcher.snapshot().getPendingJobs()).isZero();
        assertThat(harness.registry.snapshot().getAllocated()).isZero();
    }

    @Test
    void invalidSubmissionsAreRejected() {
        assertThatThrownBy(() -> dispatcher.submit(testCase("bad", "exit 0"), Priority.LOW, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> dispatcher.submit(testCase("bad", "exit 0"), null, 0.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> dispatcher.submit(testCase("bad", "exit 0", 0, null), Priority.LOW, 0.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(dispatcher.snapshot().getPendingJobs()).isZero();
    }

    @Test
    void purgeFinishedDropsOldJobs() {
        harness.withEnvironments(environment("env-1"));
        dispatcher.start();
        String jobId = dispatcher.submit(testCase("done", "exit 0"), Priority.LOW, 0.5);
        awaitStatus(jobId, JobStatus.COMPLETED);

        assertThat(dispatcher.purgeFinished(Duration.ofHours(1))).isZero();
        assertThat(dispatcher.purgeFinished(Duration.ZERO.minusSeconds(1))).isEqualTo(1);
        assertThat(dispatcher.getJob(jobId)).isEmpty();
    }
}
