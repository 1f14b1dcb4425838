package com.whereq.crucible.plan;

import com.whereq.crucible.model.ExecutionPlan;
import com.whereq.crucible.model.PlanStatus;
import com.whereq.crucible.model.TestCase;

import java.util.List;
import java.util.Optional;

/**
 * External store of execution plans written by the submission front end
 */
public interface ExecutionPlanSource {

    /**
     * Plans currently in QUEUED status
     *
     * @throws com.whereq.crucible.exception.PlanSourceException if the source cannot be read
     */
    List<ExecutionPlan> fetchQueuedPlans();

    /**
     * Resolve a test case referenced by a plan
     */
    Optional<TestCase> findTestCase(String testCaseId);

    /**
     * Write back a plan's status
     */
    void updatePlanStatus(String planId, PlanStatus status);

    /**
     * Short name used in logs and health output
     */
    String name();
}
