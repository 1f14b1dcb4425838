package com.whereq.crucible.model;

/**
 * Scheduling priority tiers, highest first: CRITICAL, HIGH, MEDIUM, LOW.
 */
public enum Priority {
    /**
     * Security fixes, regressions blocking a release
     */
    CRITICAL(4),

    /**
     * Tests touching recently changed or crash-prone code
     */
    HIGH(3),

    /**
     * Regular regression tests
     */
    MEDIUM(2),

    /**
     * Exploratory or background tests
     */
    LOW(1);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    /**
     * Integer rank, larger is more urgent
     */
    public int rank() {
        return rank;
    }

    public boolean isHigherThan(Priority other) {
        return rank > other.rank;
    }

    /**
     * Map a numeric plan priority (1 = most urgent, 10 = least) onto a tier.
     */
    public static Priority fromPlanPriority(int planPriority) {
        if (planPriority <= 2) {
            return CRITICAL;
        }
        if (planPriority <= 4) {
            return HIGH;
        }
        if (planPriority <= 6) {
            return MEDIUM;
        }
        return LOW;
    }
}
