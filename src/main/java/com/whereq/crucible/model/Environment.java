package com.whereq.crucible.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A registered execution environment. Allocation state lives in the registry.
 */
@Value
@Builder
public class Environment {
    String id;
    HardwareProfile profile;
    Instant registeredAt;
}
