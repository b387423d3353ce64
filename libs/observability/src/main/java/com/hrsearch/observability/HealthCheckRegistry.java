package com.hrsearch.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Registry that aggregates {@link HealthCheck} instances into a single {@link HealthResult}.
 * <p>
 * Checks are registered by component name. {@link #checkAll()} starts every check, then collects
 * each result with a timeout so a stuck probe cannot block the health endpoint.
 */
public final class HealthCheckRegistry {

    /** Default timeout for individual health checks (2 seconds). */
    public static final long DEFAULT_TIMEOUT_MS = 2000;

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    /**
     * Creates a registry with a custom timeout.
     *
     * @param timeoutMs timeout in milliseconds for each individual health check
     */
    public HealthCheckRegistry(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Registers a health check under the given component name.
     * Replaces any existing check for the same name.
     */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    /**
     * Removes a health check by component name.
     *
     * @return true if a check was removed
     */
    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /**
     * Runs all registered health checks and aggregates the results.
     * <p>
     * Returns {@link HealthStatus#HEALTHY} if no checks are registered. A check that fails or
     * exceeds the timeout is reported as {@link HealthStatus#UNHEALTHY}.
     */
    public HealthResult checkAll() {
        if (checks.isEmpty()) {
            return new HealthResult(HealthStatus.HEALTHY, Map.of(), Instant.now());
        }

        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, HealthCheck> entry : checks.entrySet()) {
            futures.put(entry.getKey(), start(entry.getValue()));
        }

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : futures.entrySet()) {
            String name = entry.getKey();
            ComponentHealth result;
            try {
                result = entry.getValue().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            } catch (RuntimeException e) {
                result = ComponentHealth.unhealthy(name, "Timeout or error: " + e.getMessage());
            }
            results.put(name, result);
            overall = worse(overall, result.status());
        }

        return new HealthResult(overall, results, Instant.now());
    }

    public int size() {
        return checks.size();
    }

    private static CompletableFuture<ComponentHealth> start(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static HealthStatus worse(HealthStatus a, HealthStatus b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
