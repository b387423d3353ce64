package com.hrsearch.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for a single health check component.
 * <p>
 * Implementations probe one in-process component and return the result asynchronously so the
 * registry can bound each probe with a timeout.
 * <pre>{@code
 * HealthCheck storeCheck = () -> CompletableFuture.completedFuture(
 *         store.size() > 0
 *                 ? ComponentHealth.healthy("employee-store", Map.of("records", store.size()))
 *                 : ComponentHealth.degraded("employee-store", "no records loaded", Map.of()));
 * }</pre>
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Performs a health check and returns the result asynchronously.
     *
     * @return a future that completes with the component health result
     */
    CompletableFuture<ComponentHealth> check();
}
