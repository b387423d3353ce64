package com.hrsearch.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate health result from all registered health checks.
 *
 * @param status    overall health (worst status among the components)
 * @param checks    individual component results keyed by component name
 * @param timestamp when the checks completed
 */
public record HealthResult(
        HealthStatus status,
        Map<String, ComponentHealth> checks,
        Instant timestamp
) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }
}
