package com.whereq.crucible.dto;

import com.whereq.crucible.model.HardwareProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to add an environment to the pool
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnvironmentRegistration {

    @NotBlank
    private String id;

    @NotNull
    @Valid
    private HardwareProfile profile;
}
