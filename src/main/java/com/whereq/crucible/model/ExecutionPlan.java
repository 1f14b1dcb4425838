package com.whereq.crucible.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A batch of test cases queued for execution by the submission front end
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionPlan {

    private String planId;

    @Builder.Default
    private List<String> testCaseIds = new ArrayList<>();

    /**
     * Numeric priority, 1 = most urgent, 10 = least
     */
    @Builder.Default
    private int priority = 5;

    @Builder.Default
    private PlanStatus status = PlanStatus.QUEUED;

    private Instant createdAt;
}
