package com.whereq.crucible.executor;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * What a runner reports back for one execution
 */
@Value
@Builder
public class RunnerOutput {
    int exitCode;

    @Builder.Default
    String stdout = "";

    @Builder.Default
    String stderr = "";

    Duration duration;

    /**
     * The kernel under test panicked during the run
     */
    boolean kernelPanic;
}
