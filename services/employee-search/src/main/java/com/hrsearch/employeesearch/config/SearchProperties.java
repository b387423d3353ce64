package com.hrsearch.employeesearch.config;

import com.hrsearch.ratelimit.RateLimiterConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Search behaviour: rate limiting, client identification, data source and per-organization
 * visible columns.
 *
 * <pre>
 * hrsearch:
 *   search:
 *     rate-limit:
 *       max-requests: 5
 *       window: 60s
 *       eviction-interval: 5m
 *     client-key-header: X-Client-IP
 *     employee-data: classpath:data/employees.json
 *     organizations:
 *       "[org_a]":
 *         columns: [id, first_name, last_name]
 * </pre>
 *
 * <p>Organization ids containing characters other than letters, digits, {@code -} and {@code .}
 * must be bracketed in YAML, otherwise Spring strips them from the map key.
 */
@ConfigurationProperties(prefix = "hrsearch.search")
@Validated
public record SearchProperties(
        @Valid RateLimit rateLimit,
        @NotBlank String clientKeyHeader,
        @NotBlank String employeeData,
        Map<String, Organization> organizations) {

    public static final String DEFAULT_CLIENT_KEY_HEADER = "X-Client-IP";
    public static final String DEFAULT_EMPLOYEE_DATA = "classpath:data/employees.json";

    public SearchProperties {
        if (rateLimit == null) {
            rateLimit = new RateLimit(null, null, null);
        }
        if (clientKeyHeader == null) {
            clientKeyHeader = DEFAULT_CLIENT_KEY_HEADER;
        }
        if (employeeData == null) {
            employeeData = DEFAULT_EMPLOYEE_DATA;
        }
        organizations = organizations == null ? Map.of() : new LinkedHashMap<>(organizations);
    }

    /** Organization id to configured column list, in configuration order. */
    public Map<String, List<String>> columnsByOrganization() {
        Map<String, List<String>> columns = new LinkedHashMap<>();
        organizations.forEach((id, org) -> columns.put(id, org.columns()));
        return columns;
    }

    /**
     * @param maxRequests requests admitted per client inside one window
     * @param window trailing window length
     * @param evictionInterval delay between sweeps that drop idle client keys
     */
    public record RateLimit(
            @NotNull @Positive Integer maxRequests,
            @NotNull @DurationMin(nanos = 1) Duration window,
            @NotNull @DurationMin(seconds = 1) Duration evictionInterval) {

        public RateLimit {
            if (maxRequests == null) {
                maxRequests = RateLimiterConfig.DEFAULT.maxRequests();
            }
            if (window == null) {
                window = RateLimiterConfig.DEFAULT.window();
            }
            if (evictionInterval == null) {
                evictionInterval = Duration.ofMinutes(5);
            }
        }

        public RateLimiterConfig toConfig() {
            return new RateLimiterConfig(maxRequests, window);
        }
    }

    /** @param columns visible columns, in output order; empty means "known, nothing visible" */
    public record Organization(List<String> columns) {

        public Organization {
            columns = columns == null ? List.of() : List.copyOf(columns);
        }
    }
}
