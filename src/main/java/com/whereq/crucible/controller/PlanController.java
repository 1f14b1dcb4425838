package com.whereq.crucible.controller;

import com.whereq.crucible.dto.PlanSubmitRequest;
import com.whereq.crucible.model.ExecutionPlan;
import com.whereq.crucible.plan.ExecutionPlanSource;
import com.whereq.crucible.plan.InMemoryExecutionPlanSource;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Controller feeding the in-memory execution plan source
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/plans")
@Tag(name = "Plans", description = "Execution plans picked up by the queue monitor")
public class PlanController {

    @Autowired
    private ExecutionPlanSource planSource;

    @PostMapping
    @Operation(summary = "Submit plan", description = "Store an execution plan for the next queue monitor poll")
    public Mono<ResponseEntity<ExecutionPlan>> submitPlan(@Valid @RequestBody PlanSubmitRequest request) {
        if (!(planSource instanceof InMemoryExecutionPlanSource inMemory)) {
            log.warn("Plan submitted over HTTP but the {} plan source is active", planSource.name());
            return Mono.just(ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).build());
        }
        return Mono.fromCallable(() -> inMemory.submitPlan(ExecutionPlan.builder()
                    .planId(request.getPlanId())
                    .priority(request.getPriority())
                    .build(), request.getTestCases()))
            .map(plan -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/plans/" + plan.getPlanId()))
                .body(plan));
    }

    @GetMapping("/{planId}")
    @Operation(summary = "Plan status", description = "Stored plan with its current status")
    public Mono<ResponseEntity<ExecutionPlan>> getPlan(@PathVariable String planId) {
        if (!(planSource instanceof InMemoryExecutionPlanSource inMemory)) {
            return Mono.just(ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).build());
        }
        return Mono.just(inMemory.getPlan(planId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build()));
    }
}
