package com.whereq.crucible.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.HashSet;
import java.util.Set;

/**
 * Hardware description of an execution environment
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HardwareProfile implements Serializable {
    private static final long serialVersionUID = 1L;

    @NotBlank
    private String architecture;

    private String cpuModel;

    @Positive
    private long memoryMb;

    private String storageType;

    private boolean virtual;

    @NotNull
    private BackendKind backend;

    @Builder.Default
    private Set<String> peripherals = new HashSet<>();

    /**
     * Check whether this profile satisfies a requirement.
     * A missing requirement is satisfied by any profile.
     */
    public boolean satisfies(HardwareRequirement requirement) {
        if (requirement == null) {
            return true;
        }
        if (requirement.getArchitecture() != null && !requirement.getArchitecture().equals(architecture)) {
            return false;
        }
        if (memoryMb < requirement.getMemoryMb()) {
            return false;
        }
        Set<String> required = requirement.getPeripherals();
        return required == null || required.isEmpty()
            || (peripherals != null && peripherals.containsAll(required));
    }
}
