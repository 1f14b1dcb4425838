package com.whereq.crucible.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the dispatcher needs to enqueue a job
 */
@Value
@Builder
public class JobRequest {
    TestCase testCase;

    @Builder.Default
    Priority priority = Priority.MEDIUM;

    @Builder.Default
    double impactScore = 0.5;

    String planId;

    Notifications notifications;

    /**
     * Ids of jobs that must complete first
     */
    @Builder.Default
    List<String> dependencies = List.of();
}
