package com.whereq.crucible.resource;

/**
 * Result of deregistering an environment
 */
public enum RemovalOutcome {
    /**
     * Environment was idle and left the pool immediately
     */
    REMOVED,

    /**
     * Environment is allocated; it leaves the pool once its job releases it
     */
    RETIRED,

    /**
     * No such environment
     */
    NOT_FOUND
}
