package com.whereq.crucible.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.HashSet;
import java.util.Set;

/**
 * Hardware a test case needs from its environment
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HardwareRequirement implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * CPU architecture, matched exactly (x86_64, arm64, riscv64, ...)
     */
    @NotBlank
    private String architecture;

    /**
     * Minimum memory in megabytes
     */
    @PositiveOrZero
    private long memoryMb;

    /**
     * Peripheral types the environment must expose (gpio, i2c, usb, ...)
     */
    @Builder.Default
    private Set<String> peripherals = new HashSet<>();

    /**
     * Workload is CPU bound and should prefer a full-machine backend
     */
    private boolean cpuIntensive;
}
