package com.whereq.crucible.controller;

import com.whereq.crucible.dto.EnvironmentRegistration;
import com.whereq.crucible.exception.EnvironmentConflictException;
import com.whereq.crucible.model.Environment;
import com.whereq.crucible.model.EnvironmentStatus;
import com.whereq.crucible.resource.RemovalOutcome;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Controller for the execution environment pool
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/environments")
@Tag(name = "Environments", description = "Execution environment pool management")
public class EnvironmentController {

    @Autowired
    private OrchestratorService orchestratorService;

    @GetMapping
    @Operation(summary = "List environments", description = "All environments with allocation state and utilization")
    public Mono<ResponseEntity<List<EnvironmentStatus>>> listEnvironments() {
        return Mono.fromCallable(() -> ResponseEntity.ok(orchestratorService.listEnvironments()))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping
    @Operation(summary = "Add environment", description = "Register a new environment with the pool")
    public Mono<ResponseEntity<Environment>> addEnvironment(@Valid @RequestBody EnvironmentRegistration registration) {
        return Mono.fromCallable(() -> orchestratorService.addEnvironment(registration.getId(), registration.getProfile()))
            .subscribeOn(Schedulers.boundedElastic())
            .map(environment -> ResponseEntity
                .created(URI.create("/api/v1/environments/" + environment.getId()))
                .body(environment))
            .onErrorResume(EnvironmentConflictException.class, e -> {
                log.warn("Environment registration rejected: {}", e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).build());
            })
            .onErrorResume(IllegalArgumentException.class, e -> Mono.just(ResponseEntity.badRequest().build()));
    }

    @DeleteMapping("/{environmentId}")
    @Operation(summary = "Remove environment",
        description = "Remove an environment; an allocated one leaves the pool when its job finishes")
    public Mono<ResponseEntity<Map<String, Object>>> removeEnvironment(@PathVariable String environmentId) {
        return Mono.fromCallable(() -> orchestratorService.removeEnvironment(environmentId))
            .subscribeOn(Schedulers.boundedElastic())
            .map(outcome -> {
                if (outcome == RemovalOutcome.NOT_FOUND) {
                    return ResponseEntity.notFound().<Map<String, Object>>build();
                }
                Map<String, Object> body = new HashMap<>();
                body.put("environmentId", environmentId);
                body.put("outcome", outcome);
                return ResponseEntity.ok(body);
            });
    }

    @PostMapping("/{environmentId}/failure")
    @Operation(summary = "Report environment failure",
        description = "Drop a failed environment from the pool and fail the job running on it")
    public Mono<ResponseEntity<Map<String, Object>>> reportFailure(
            @PathVariable String environmentId,
            @RequestParam(defaultValue = "reported failure") String reason) {
        return Mono.fromCallable(() -> orchestratorService.reportEnvironmentFailure(environmentId, reason))
            .subscribeOn(Schedulers.boundedElastic())
            .map(affected -> {
                Map<String, Object> body = new HashMap<>();
                body.put("environmentId", environmentId);
                body.put("affectedJob", affected.orElse(null));
                return ResponseEntity.ok(body);
            })
            .onErrorResume(IllegalArgumentException.class, e -> Mono.just(ResponseEntity.notFound().build()));
    }
}
