package com.hrsearch.employeesearch.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service.
 *
 * <p>Bound from the {@code hrsearch.service.*} prefix and validated at startup; a blank name fails
 * the boot.
 *
 * <pre>
 * hrsearch:
 *   service:
 *     name: employee-search
 *     environment: production
 *     description: Employee directory search
 * </pre>
 *
 * @param name Service name used for logging and the {@code service} metric tag. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param description Human-readable service description for /actuator/info.
 */
@ConfigurationProperties(prefix = "hrsearch.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    /**
     * Compact constructor: applies defaults for optional fields. Runs BEFORE Bean Validation, so
     * defaults satisfy constraints.
     */
    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
