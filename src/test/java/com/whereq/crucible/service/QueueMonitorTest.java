package com.whereq.crucible.service;

import com.whereq.crucible.model.ExecutionPlan;
import com.whereq.crucible.model.Job;
import com.whereq.crucible.model.PlanStatus;
import com.whereq.crucible.model.Priority;
import com.whereq.crucible.model.TestCase;
import com.whereq.crucible.plan.ExecutionPlanSource;
import com.whereq.crucible.support.OrchestratorHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.whereq.crucible.support.TestFixtures.environment;
import static com.whereq.crucible.support.TestFixtures.testCase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueueMonitorTest {

    private OrchestratorHarness harness;

    @BeforeEach
    void setUp() {
        harness = new OrchestratorHarness();
    }

    @AfterEach
    void tearDown() {
        harness.shutdown();
    }

    private ExecutionPlan submitPlan(int priority, TestCase... cases) {
        return harness.planSource.submitPlan(ExecutionPlan.builder().priority(priority).build(), List.of(cases));
    }

    @Test
    void queuedPlanBecomesJobsOnce() {
        ExecutionPlan plan = submitPlan(1, testCase("a", "exit 0"), testCase("b", "exit 0"));

        assertThat(harness.queueMonitor.poll()).isEqualTo(1);
        assertThat(harness.queueMonitor.poll()).isZero();

        List<Job> jobs = harness.dispatcher.activeJobs();
        assertThat(jobs).hasSize(2);
        assertThat(jobs).allSatisfy(job -> {
            assertThat(job.getPriority()).isEqualTo(Priority.CRITICAL);
            assertThat(job.getPlanId()).isEqualTo(plan.getPlanId());
        });
        assertThat(harness.planSource.getPlan(plan.getPlanId()).orElseThrow().getStatus()).isEqualTo(PlanStatus.RUNNING);
        assertThat(harness.queueMonitor.getProcessedPlans()).containsExactly(plan.getPlanId());
    }

    @Test
    void planStatusIsPublishedWhenJobsFinish() {
        harness.withEnvironments(environment("env-1"));
        harness.dispatcher.start();
        ExecutionPlan passing = submitPlan(5, testCase("ok-1", "exit 0"), testCase("ok-2", "sleep 10"));
        ExecutionPlan failing = submitPlan(8, testCase("bad", "exit 2"));

        harness.queueMonitor.poll();

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            harness.queueMonitor.poll();
            assertThat(harness.planSource.getPlan(passing.getPlanId()).orElseThrow().getStatus())
                .isEqualTo(PlanStatus.COMPLETED);
            assertThat(harness.planSource.getPlan(failing.getPlanId()).orElseThrow().getStatus())
                .isEqualTo(PlanStatus.FAILED);
        });
    }

    @Test
    void planWithOnlyUnknownTestCasesFails() {
        ExecutionPlan plan = ExecutionPlan.builder().testCaseIds(List.of("tc-missing")).build();
        harness.planSource.submitPlan(plan, List.of());

        harness.queueMonitor.poll();
        assertThat(harness.dispatcher.activeJobs()).isEmpty();
        assertThat(harness.statusTracker.planStatuses()).containsEntry(plan.getPlanId(), PlanStatus.FAILED);

        harness.queueMonitor.poll();
        assertThat(harness.planSource.getPlan(plan.getPlanId()).orElseThrow().getStatus()).isEqualTo(PlanStatus.FAILED);
    }

    @Test
    void restoredPlansAreNotQueuedAgain() {
        ExecutionPlan plan = submitPlan(5, testCase("a", "exit 0"));
        harness.queueMonitor.restoreProcessedPlans(List.of(plan.getPlanId()));

        assertThat(harness.queueMonitor.poll()).isZero();
        assertThat(harness.dispatcher.activeJobs()).isEmpty();
    }

    @Test
    void sourceFailureDegradesMonitorUntilReachable() {
        ExecutionPlanSource source = mock(ExecutionPlanSource.class);
        when(source.name()).thenReturn("mock");
        when(source.fetchQueuedPlans())
            .thenThrow(new IllegalStateException("connection refused"))
            .thenReturn(List.of());
        QueueMonitor monitor = new QueueMonitor(harness.properties, source, harness.dispatcher,
            harness.statusTracker, harness.recoveryManager);

        monitor.start();
        try {
            await().atMost(Duration.ofSeconds(5)).until(() -> !harness.recoveryManager.recentErrors().isEmpty());
            await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(monitor.health().getMessage()).isNull());
        } finally {
            monitor.stop();
        }
        verify(source, never()).updatePlanStatus(any(), eq(PlanStatus.RUNNING));
    }

    @Test
    void jobsFromPlanRunToCompletion() {
        harness.withEnvironments(environment("env-1"));
        harness.dispatcher.start();
        submitPlan(3, testCase("only", "exit 0"));

        harness.queueMonitor.poll();

        await().atMost(Duration.ofSeconds(10)).until(() -> harness.statusTracker.metrics().getCompletedTests() == 1);
        assertThat(harness.dispatcher.snapshot().getPendingJobs()).isZero();
        assertThat(harness.runner.getStartOrder()).containsExactly("only");
        assertThat(harness.dispatcher.getTotalProcessed()).isEqualTo(1);
    }
}
