package com.whereq.crucible.plan;

import com.whereq.crucible.model.ExecutionPlan;
import com.whereq.crucible.model.PlanStatus;
import com.whereq.crucible.model.TestCase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Plan source held in memory, fed through the plans REST endpoint
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "crucible.monitor.plan-source", havingValue = "in_memory", matchIfMissing = true)
public class InMemoryExecutionPlanSource implements ExecutionPlanSource {

    private final Map<String, ExecutionPlan> plans = new ConcurrentHashMap<>();

    private final Map<String, TestCase> testCases = new ConcurrentHashMap<>();

    /**
     * Store a plan together with the test cases it references
     *
     * @return the stored plan
     */
    public ExecutionPlan submitPlan(ExecutionPlan plan, List<TestCase> cases) {
        for (TestCase testCase : cases) {
            if (testCase.getId() == null) {
                testCase.setId("tc-" + UUID.randomUUID().toString().substring(0, 8));
            }
            testCases.put(testCase.getId(), testCase);
        }
        if (plan.getPlanId() == null) {
            plan.setPlanId("plan-" + UUID.randomUUID());
        }
        if (plan.getCreatedAt() == null) {
            plan.setCreatedAt(Instant.now());
        }
        if (plan.getTestCaseIds().isEmpty()) {
            plan.setTestCaseIds(cases.stream().map(TestCase::getId).toList());
        }
        plan.setStatus(PlanStatus.QUEUED);
        plans.put(plan.getPlanId(), plan);
        log.info("Plan {} stored with {} test cases", plan.getPlanId(), plan.getTestCaseIds().size());
        return plan;
    }

    public Optional<ExecutionPlan> getPlan(String planId) {
        return Optional.ofNullable(plans.get(planId));
    }

    @Override
    public List<ExecutionPlan> fetchQueuedPlans() {
        List<ExecutionPlan> queued = new ArrayList<>();
        for (ExecutionPlan plan : plans.values()) {
            if (plan.getStatus() == PlanStatus.QUEUED) {
                queued.add(plan);
            }
        }
        queued.sort(Comparator.comparing(ExecutionPlan::getCreatedAt));
        return queued;
    }

    @Override
    public Optional<TestCase> findTestCase(String testCaseId) {
        return Optional.ofNullable(testCases.get(testCaseId));
    }

    @Override
    public void updatePlanStatus(String planId, PlanStatus status) {
        ExecutionPlan plan = plans.get(planId);
        if (plan == null) {
            log.warn("Attempted to update unknown plan: {}", planId);
            return;
        }
        plan.setStatus(status);
    }

    @Override
    public String name() {
        return "in-memory";
    }
}
