package com.hrsearch.employeesearch.infrastructure.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.hrsearch.directory.store.InMemoryEmployeeStore;
import com.hrsearch.directory.visibility.VisibilityPolicy;
import com.hrsearch.observability.HealthCheckRegistry;
import com.hrsearch.observability.HealthStatus;
import com.hrsearch.observability.testing.InMemoryHealthCheck;
import com.hrsearch.ratelimit.RateLimiterConfig;
import com.hrsearch.ratelimit.SlidingWindowRateLimiter;
import com.hrsearch.ratelimit.clock.ManualClock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@DisplayName("Search health")
class DirectoryHealthIndicatorTest {

    @Nested
    @DisplayName("DirectoryHealthIndicator")
    class Indicator {

        @Test
        @DisplayName("reports UP when every check is healthy")
        void upWhenHealthy() {
            var registry = new HealthCheckRegistry();
            registry.register("store", new InMemoryHealthCheck("store"));

            Health health = new DirectoryHealthIndicator(registry).health();

            assertThat(health.getStatus()).isEqualTo(Status.UP);
            assertThat(health.getDetails()).containsKeys("store", "checkedAt");
        }

        @Test
        @DisplayName("reports UP with a degraded flag when a check is degraded")
        void upWhenDegraded() {
            var registry = new HealthCheckRegistry();
            registry.register("store", new InMemoryHealthCheck("store").setDegraded("empty"));

            Health health = new DirectoryHealthIndicator(registry).health();

            assertThat(health.getStatus()).isEqualTo(Status.UP);
            assertThat(health.getDetails()).containsEntry("degraded", true);
        }

        @Test
        @DisplayName("reports DOWN when a check is unhealthy")
        void downWhenUnhealthy() {
            var registry = new HealthCheckRegistry();
            registry.register("store", new InMemoryHealthCheck("store"));
            registry.register("limiter", new InMemoryHealthCheck("limiter").setUnhealthy("broken"));

            assertThat(new DirectoryHealthIndicator(registry).health().getStatus()).isEqualTo(Status.DOWN);
        }

        @Test
        @DisplayName("maps every status")
        void mapsStatuses() {
            assertThat(DirectoryHealthIndicator.toStatus(HealthStatus.HEALTHY)).isEqualTo(Status.UP);
            assertThat(DirectoryHealthIndicator.toStatus(HealthStatus.DEGRADED)).isEqualTo(Status.UP);
            assertThat(DirectoryHealthIndicator.toStatus(HealthStatus.UNHEALTHY)).isEqualTo(Status.DOWN);
        }
    }

    @Nested
    @DisplayName("SearchHealthChecks")
    class Checks {

        @Test
        @DisplayName("registers store and limiter checks")
        void registersChecks() {
            var registry = new HealthCheckRegistry();
            var limiter = new SlidingWindowRateLimiter(new ManualClock(0), RateLimiterConfig.DEFAULT);
            limiter.tryAcquire("client");

            new SearchHealthChecks(registry, new InMemoryEmployeeStore(List.of()),
                    new VisibilityPolicy(Map.of("org_a", List.of("id"))), limiter);

            var result = registry.checkAll();
            assertThat(result.checks()).containsOnlyKeys(
                    SearchHealthChecks.EMPLOYEE_STORE, SearchHealthChecks.RATE_LIMITER);
            assertThat(result.checks().get(SearchHealthChecks.EMPLOYEE_STORE).status())
                    .isEqualTo(HealthStatus.DEGRADED);
            assertThat(result.checks().get(SearchHealthChecks.RATE_LIMITER).details())
                    .containsEntry("trackedKeys", 1)
                    .containsEntry("maxRequests", 5);
            assertThat(result.status()).isEqualTo(HealthStatus.DEGRADED);
        }
    }
}
