package com.hrsearch.observability;

import java.util.Map;

/**
 * Health result for a single component.
 *
 * @param name    component name (e.g., "employee-store", "rate-limiter")
 * @param status  health status of this component
 * @param message optional human-readable message
 * @param details component-specific figures such as record or key counts
 */
public record ComponentHealth(String name, HealthStatus status, String message, Map<String, Object> details) {

    public ComponentHealth {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /** Creates a healthy component result. */
    public static ComponentHealth healthy(String name, Map<String, Object> details) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, details);
    }

    /** Creates a degraded component result. */
    public static ComponentHealth degraded(String name, String message, Map<String, Object> details) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, details);
    }

    /** Creates an unhealthy component result. */
    public static ComponentHealth unhealthy(String name, String message) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, Map.of());
    }
}
