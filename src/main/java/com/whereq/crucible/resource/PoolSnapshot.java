package com.whereq.crucible.resource;

import lombok.Value;

/**
 * Environment counts taken under the registry lock
 */
@Value
public class PoolSnapshot {
    int available;
    int allocated;
    int total;

    public double utilizationPercent() {
        return total > 0 ? (allocated * 100.0) / total : 0.0;
    }
}
