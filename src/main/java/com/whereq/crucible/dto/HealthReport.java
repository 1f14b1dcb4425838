package com.whereq.crucible.dto;

import com.whereq.crucible.model.ComponentHealth;
import com.whereq.crucible.model.HealthState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate orchestrator health
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthReport {
    /**
     * HEALTHY, DEGRADED, or STOPPED when the service is not running
     */
    private HealthState status;

    private boolean running;

    private Instant startedAt;

    private Duration uptime;

    /**
     * Reason for DEGRADED, if any
     */
    private String message;

    @Builder.Default
    private Map<String, ComponentHealth> components = new LinkedHashMap<>();

    private Map<String, Object> errors;
}
