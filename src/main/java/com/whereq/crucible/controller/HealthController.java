package com.whereq.crucible.controller;

import com.whereq.crucible.dto.HealthReport;
import com.whereq.crucible.dto.SystemMetrics;
import com.whereq.crucible.model.HealthState;
import com.whereq.crucible.service.OrchestratorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.Map;

/**
 * Health, metrics and lifecycle endpoints of the orchestrator.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private OrchestratorService orchestratorService;

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Aggregate and per-component orchestrator health")
    public Mono<ResponseEntity<HealthReport>> health() {
        return Mono.fromCallable(orchestratorService::getHealthStatus)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("Health check failed", e);
                return Mono.just(ResponseEntity.ok(HealthReport.builder()
                    .status(HealthState.DEGRADED)
                    .running(orchestratorService.isRunning())
                    .message("Health check failed: " + e.getMessage())
                    .build()));
            });
    }

    @GetMapping("/metrics")
    @Operation(summary = "System metrics", description = "Aggregate job and environment counters")
    public Mono<ResponseEntity<SystemMetrics>> metrics() {
        return Mono.fromCallable(orchestratorService::getSystemMetrics)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/orchestrator/start")
    @Operation(summary = "Start orchestrator", description = "Start all components, no-op when running")
    public Mono<ResponseEntity<Map<String, Object>>> start() {
        return Mono.fromCallable(orchestratorService::start)
            .subscribeOn(Schedulers.boundedElastic())
            .map(started -> ResponseEntity.ok(lifecycleBody(started)));
    }

    @PostMapping("/orchestrator/stop")
    @Operation(summary = "Stop orchestrator", description = "Cancel outstanding work and stop all components")
    public Mono<ResponseEntity<Map<String, Object>>> stop() {
        return Mono.fromCallable(orchestratorService::stop)
            .subscribeOn(Schedulers.boundedElastic())
            .map(stopped -> ResponseEntity.ok(lifecycleBody(stopped)));
    }

    private Map<String, Object> lifecycleBody(boolean success) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", success);
        body.put("running", orchestratorService.isRunning());
        return body;
    }
}
