package com.hrsearch.employeesearch.infrastructure.health;

import com.hrsearch.observability.ComponentHealth;
import com.hrsearch.observability.HealthCheckRegistry;
import com.hrsearch.observability.HealthResult;
import com.hrsearch.observability.HealthStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Exposes the {@link HealthCheckRegistry} through Actuator as the {@code directory} component.
 *
 * <p>HEALTHY maps to UP, DEGRADED to UP with a {@code degraded} detail (the service still answers
 * searches), UNHEALTHY to DOWN.
 */
@Component("directory")
public class DirectoryHealthIndicator implements HealthIndicator {

    private final HealthCheckRegistry registry;

    public DirectoryHealthIndicator(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        HealthResult result = registry.checkAll();
        Health.Builder builder = new Health.Builder(toStatus(result.status()));
        for (ComponentHealth component : result.checks().values()) {
            builder.withDetail(component.name(), component);
        }
        if (result.status() == HealthStatus.DEGRADED) {
            builder.withDetail("degraded", true);
        }
        return builder.withDetail("checkedAt", result.timestamp().toString()).build();
    }

    static Status toStatus(HealthStatus status) {
        return switch (status) {
            case HEALTHY, DEGRADED -> Status.UP;
            case UNHEALTHY -> Status.DOWN;
        };
    }
}
