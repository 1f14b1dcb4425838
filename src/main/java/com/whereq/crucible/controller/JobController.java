package com.whereq.crucible.controller;

import com.whereq.crucible.dto.JobCancellationResponse;
import com.whereq.crucible.dto.JobStatusResponse;
import com.whereq.crucible.dto.JobSubmitRequest;
import com.whereq.crucible.dto.JobSubmitResponse;
import com.whereq.crucible.exception.JobNotFoundException;
import com.whereq.crucible.model.Job;
import com.whereq.crucible.model.JobRequest;
import com.whereq.crucible.model.JobStatus;
import com.whereq.crucible.model.QueueSnapshot;
import com.whereq.crucible.service.OrchestratorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.time.Instant;
import java.util.List;

/**
 * Controller for test job submission, status and cancellation
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Jobs", description = "Test job submission and tracking")
public class JobController {

    @Autowired
    private OrchestratorService orchestratorService;

    /**
     * Submit a test case for execution
     *
     * @param request job request
     * @return Mono with 202 Accepted response
     */
    @PostMapping("/jobs")
    @Operation(summary = "Submit job", description = "Queue a test case for prioritized execution")
    public Mono<ResponseEntity<JobSubmitResponse>> submitJob(@Valid @RequestBody JobSubmitRequest request) {
        log.info("Received job submission: test={}, priority={}",
            request.getTestCase().getName(), request.getPriority());

        return Mono.fromCallable(() -> orchestratorService.submitJob(JobRequest.builder()
                .testCase(request.getTestCase())
                .priority(request.getPriority())
                .impactScore(request.getImpactScore())
                .notifications(request.getNotifications())
                .dependencies(request.getDependencies() != null ? request.getDependencies() : List.of())
                .build()))
            .subscribeOn(Schedulers.boundedElastic())
            .map(jobId -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + jobId))
                .body(JobSubmitResponse.builder()
                    .jobId(jobId)
                    .status(JobStatus.PENDING)
                    .submittedAt(Instant.now())
                    .build()))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobSubmitResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    /**
     * Get job status
     *
     * @param jobId job identifier
     * @return Mono with job status and result once finished
     */
    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Job status", description = "Current status of a job and its result once finished")
    public Mono<ResponseEntity<JobStatusResponse>> getJobStatus(@PathVariable String jobId) {
        return Mono.fromCallable(() -> orchestratorService.getJobStatus(jobId))
            .subscribeOn(Schedulers.boundedElastic())
            .map(status -> status
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    /**
     * List pending and running jobs in admission order
     */
    @GetMapping("/jobs")
    @Operation(summary = "Active jobs", description = "Pending and running jobs in admission order")
    public Mono<ResponseEntity<List<Job>>> listActiveJobs() {
        return Mono.fromCallable(() -> ResponseEntity.ok(orchestratorService.getActiveJobs()))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Cancel a job
     *
     * @param jobId job identifier
     * @return Mono with cancellation response
     */
    @DeleteMapping("/jobs/{jobId}")
    @Operation(summary = "Cancel job", description = "Cancel a pending or running job")
    public Mono<ResponseEntity<JobCancellationResponse>> cancelJob(@PathVariable String jobId) {
        log.info("Job cancellation request for {}", jobId);

        return Mono.fromCallable(() -> orchestratorService.cancelJob(jobId))
            .subscribeOn(Schedulers.boundedElastic())
            .map(job -> ResponseEntity.ok(JobCancellationResponse.builder()
                .jobId(job.getJobId())
                .status(job.getStatus())
                .cancelledAt(job.getFinishedAt())
                .message("Job cancelled")
                .build()))
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(IllegalStateException.class, e -> {
                log.error("Invalid state for cancellation: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.CONFLICT)
                    .body(JobCancellationResponse.builder()
                        .jobId(jobId)
                        .message(e.getMessage())
                        .build()));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Error cancelling job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }

    /**
     * Queue and pool counts
     */
    @GetMapping("/queue")
    @Operation(summary = "Queue status", description = "Running and pending jobs, available and allocated environments")
    public Mono<ResponseEntity<QueueSnapshot>> getQueueStatus() {
        return Mono.fromCallable(() -> ResponseEntity.ok(orchestratorService.getQueueStatus()))
            .subscribeOn(Schedulers.boundedElastic());
    }
}
