package com.hrsearch.employeesearch.infrastructure.health;

import com.hrsearch.directory.store.EmployeeStore;
import com.hrsearch.directory.visibility.VisibilityPolicy;
import com.hrsearch.observability.ComponentHealth;
import com.hrsearch.observability.HealthCheckRegistry;
import com.hrsearch.ratelimit.RateLimiterConfig;
import com.hrsearch.ratelimit.SlidingWindowRateLimiter;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

/**
 * Registers the search components' checks with the {@link HealthCheckRegistry}.
 *
 * <ul>
 *   <li>{@code employee-store}: degraded when no records were loaded
 *   <li>{@code rate-limiter}: always healthy, reports tracked keys and quota
 * </ul>
 */
@Component
public class SearchHealthChecks {

    public static final String EMPLOYEE_STORE = "employee-store";
    public static final String RATE_LIMITER = "rate-limiter";

    public SearchHealthChecks(
            HealthCheckRegistry registry,
            EmployeeStore employeeStore,
            VisibilityPolicy visibilityPolicy,
            SlidingWindowRateLimiter rateLimiter) {
        registry.register(EMPLOYEE_STORE, () -> CompletableFuture.completedFuture(
                storeHealth(employeeStore, visibilityPolicy)));
        registry.register(RATE_LIMITER, () -> CompletableFuture.completedFuture(
                limiterHealth(rateLimiter)));
    }

    static ComponentHealth storeHealth(EmployeeStore store, VisibilityPolicy policy) {
        Map<String, Object> details = Map.of(
                "employees", store.size(),
                "organizationsWithRecords", store.organizationIds().size(),
                "configuredOrganizations", policy.organizationIds().size());
        if (store.size() == 0) {
            return ComponentHealth.degraded(EMPLOYEE_STORE, "No employee records loaded", details);
        }
        return ComponentHealth.healthy(EMPLOYEE_STORE, details);
    }

    static ComponentHealth limiterHealth(SlidingWindowRateLimiter limiter) {
        RateLimiterConfig config = limiter.config();
        return ComponentHealth.healthy(RATE_LIMITER, Map.of(
                "trackedKeys", limiter.trackedKeys(),
                "maxRequests", config.maxRequests(),
                "windowSeconds", config.windowSeconds()));
    }
}
