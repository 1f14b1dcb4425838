package com.whereq.crucible.executor;

import com.whereq.crucible.model.Environment;
import com.whereq.crucible.model.TestCase;

/**
 * Executes a test script inside an environment
 */
public interface TestRunner {
    /**
     * Execute a test synchronously (blocking). May hang, the caller enforces deadlines.
     *
     * @param jobId job identifier, used for later terminate and output calls
     * @param testCase test to run
     * @param environment environment allocated to the job
     * @return runner output
     * @throws Exception if execution fails
     */
    RunnerOutput execute(String jobId, TestCase testCase, Environment environment) throws Exception;

    /**
     * Terminate a running job
     *
     * @param jobId job identifier
     */
    default void terminate(String jobId) {
        // Default: no-op
    }

    /**
     * Output captured so far for a running job
     *
     * @param jobId job identifier
     * @return partial stdout, empty if none
     */
    default String partialOutput(String jobId) {
        return "";
    }
}
