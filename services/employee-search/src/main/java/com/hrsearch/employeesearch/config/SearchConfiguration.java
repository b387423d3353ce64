package com.hrsearch.employeesearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hrsearch.directory.store.EmployeeDataLoader;
import com.hrsearch.directory.store.EmployeeStore;
import com.hrsearch.directory.visibility.ColumnProjector;
import com.hrsearch.directory.visibility.VisibilityPolicy;
import com.hrsearch.observability.HealthCheckRegistry;
import com.hrsearch.observability.MetricFactory;
import com.hrsearch.ratelimit.SlidingWindowRateLimiter;
import com.hrsearch.ratelimit.clock.Clock;
import com.hrsearch.ratelimit.clock.SystemClock;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the directory, visibility and rate-limit libraries into the Spring context.
 *
 * <p>Every component built here is immutable or internally synchronized and is shared by all
 * request threads. The rate limiter is an owned singleton bean, never a static.
 */
@Configuration
public class SearchConfiguration {

    @Bean
    public Clock rateLimitClock() {
        return SystemClock.instance();
    }

    @Bean
    public SlidingWindowRateLimiter rateLimiter(Clock clock, SearchProperties properties) {
        return new SlidingWindowRateLimiter(clock, properties.rateLimit().toConfig());
    }

    @Bean
    public EmployeeStore employeeStore(
            SearchProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(properties.employeeData());
        try {
            return new EmployeeDataLoader(objectMapper)
                    .load(resource.getInputStream(), properties.employeeData());
        } catch (IOException e) {
            throw new UncheckedIOException(
                    "Cannot open employee data " + properties.employeeData(), e);
        }
    }

    @Bean
    public VisibilityPolicy visibilityPolicy(SearchProperties properties) {
        return new VisibilityPolicy(properties.columnsByOrganization());
    }

    @Bean
    public ColumnProjector columnProjector() {
        return new ColumnProjector();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry() {
        return new HealthCheckRegistry();
    }
}
