package com.whereq.crucible.dto;

import com.whereq.crucible.model.Notifications;
import com.whereq.crucible.model.Priority;
import com.whereq.crucible.model.TestCase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to run a single test case
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitRequest {

    @NotNull
    @Valid
    private TestCase testCase;

    @Builder.Default
    private Priority priority = Priority.MEDIUM;

    /**
     * Estimated value of the test, 0.0 to 1.0
     */
    @Builder.Default
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double impactScore = 0.5;

    private Notifications notifications;

    /**
     * Ids of previously submitted jobs that must complete first
     */
    private List<String> dependencies;
}
