package com.whereq.crucible.dto;

import com.whereq.crucible.model.Job;
import com.whereq.crucible.model.JobResult;
import com.whereq.crucible.model.JobStatus;
import com.whereq.crucible.model.Priority;
import com.whereq.crucible.model.StatusTransition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Job status with its result once finished
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {
    private String jobId;
    private String testName;
    private JobStatus status;
    private Priority priority;
    private double impactScore;
    private String planId;
    private List<String> dependencies;
    private String environmentId;
    private Instant submittedAt;
    private Instant startedAt;
    private Instant deadline;
    private int attempt;
    private String lastError;

    /**
     * Present only for terminal statuses
     */
    private JobResult result;

    private List<StatusTransition> transitions;

    public static JobStatusResponse from(Job job, List<StatusTransition> transitions) {
        return JobStatusResponse.builder()
            .jobId(job.getJobId())
            .testName(job.getTestCase().getName())
            .status(job.getStatus())
            .priority(job.getPriority())
            .impactScore(job.getImpactScore())
            .planId(job.getPlanId())
            .dependencies(job.getDependencies())
            .environmentId(job.getEnvironmentId())
            .submittedAt(job.getSubmittedAt())
            .startedAt(job.getStartedAt())
            .deadline(job.getDeadline())
            .attempt(job.getAttempt())
            .lastError(job.getLastError())
            .result(job.getStatus().isTerminal() ? job.getResult() : null)
            .transitions(transitions)
            .build();
    }
}
