package com.whereq.crucible.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Test specification handed to the orchestrator
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestCase implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;

    @NotBlank
    private String name;

    /**
     * Kernel subsystem under test (mm, fs, net, sched, ...)
     */
    private String targetSubsystem;

    /**
     * Command or script the runner executes
     */
    @NotBlank
    private String script;

    /**
     * Estimated duration in seconds
     */
    @Positive
    private long estimatedDurationSeconds;

    @Valid
    private HardwareRequirement requiredHardware;

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    public Duration estimatedDuration() {
        return Duration.ofSeconds(estimatedDurationSeconds);
    }
}
