package com.whereq.crucible.recovery;

/**
 * Classification of reported errors
 */
public enum ErrorCategory {
    /**
     * Runner crashed or test could not be executed
     */
    TEST_EXECUTION,

    /**
     * Environment vanished or became unusable
     */
    ENVIRONMENT_FAILURE,

    /**
     * No capacity left to admit work
     */
    RESOURCE_EXHAUSTION,

    /**
     * A job overran its deadline
     */
    TIMEOUT,

    /**
     * Plan source or other external dependency unreachable
     */
    EXTERNAL_SOURCE,

    /**
     * Invalid input or configuration
     */
    CONFIGURATION,

    /**
     * Unexpected failure inside an orchestrator component
     */
    SYSTEM_ERROR
}
