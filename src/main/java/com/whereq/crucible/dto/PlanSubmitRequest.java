package com.whereq.crucible.dto;

import com.whereq.crucible.model.TestCase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Execution plan with its test cases, for the in-memory plan source
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanSubmitRequest {

    private String planId;

    /**
     * 1 = most urgent, 10 = least
     */
    @Builder.Default
    @Min(1)
    @Max(10)
    private int priority = 5;

    @NotEmpty
    @Valid
    private List<TestCase> testCases;
}
