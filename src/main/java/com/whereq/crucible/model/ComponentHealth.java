package com.whereq.crucible.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Health probe result of a single component
 */
@Value
@Builder
public class ComponentHealth {
    String component;
    HealthState state;
    String message;

    @Singular
    Map<String, Object> details;

    public static ComponentHealth healthy(String component) {
        return ComponentHealth.builder().component(component).state(HealthState.HEALTHY).build();
    }

    public static ComponentHealth degraded(String component, String message) {
        return ComponentHealth.builder().component(component).state(HealthState.DEGRADED).message(message).build();
    }

    public static ComponentHealth stopped(String component) {
        return ComponentHealth.builder().component(component).state(HealthState.STOPPED).build();
    }
}
