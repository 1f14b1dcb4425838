package com.whereq.crucible.controller;

import com.whereq.crucible.dto.HealthReport;
import com.whereq.crucible.dto.SystemMetrics;
import com.whereq.crucible.model.HealthState;
import com.whereq.crucible.service.OrchestratorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private OrchestratorService orchestratorService;

    @InjectMocks
    private HealthController controller;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(controller).build();
    }

    @Test
    void healthReportsDegradation() {
        when(orchestratorService.getHealthStatus()).thenReturn(HealthReport.builder()
            .status(HealthState.DEGRADED)
            .running(true)
            .message("errorRecovery: 1 environment failures")
            .build());

        client.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("DEGRADED")
            .jsonPath("$.message").isEqualTo("errorRecovery: 1 environment failures");
    }

    @Test
    void failingHealthCheckStillAnswers() {
        when(orchestratorService.getHealthStatus()).thenThrow(new IllegalStateException("boom"));
        when(orchestratorService.isRunning()).thenReturn(false);

        client.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("DEGRADED")
            .jsonPath("$.running").isEqualTo(false);
    }

    @Test
    void metrics() {
        when(orchestratorService.getSystemMetrics()).thenReturn(SystemMetrics.builder()
            .completedTests(5)
            .peakRunning(2)
            .peakPending(3)
            .build());

        client.get().uri("/api/v1/metrics")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.completedTests").isEqualTo(5)
            .jsonPath("$.peakPending").isEqualTo(3);
    }

    @Test
    void startAndStop() {
        when(orchestratorService.start()).thenReturn(true);
        when(orchestratorService.stop()).thenReturn(true);
        when(orchestratorService.isRunning()).thenReturn(true, false);

        client.post().uri("/api/v1/orchestrator/start").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.running").isEqualTo(true);
        client.post().uri("/api/v1/orchestrator/stop").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.running").isEqualTo(false);
    }
}
