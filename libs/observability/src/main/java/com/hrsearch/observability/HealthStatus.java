package com.hrsearch.observability;

/**
 * Health status for an individual component or the aggregate service.
 */
public enum HealthStatus {

    /** Component is serving normally. */
    HEALTHY,

    /** Component still serves searches but needs attention (e.g. empty data set). */
    DEGRADED,

    /** Component cannot serve searches. */
    UNHEALTHY
}
