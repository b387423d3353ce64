package com.hrsearch.employeesearch;

import com.hrsearch.employeesearch.config.SearchProperties;
import com.hrsearch.employeesearch.config.ServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Employee directory search service.
 *
 * <p>Key features configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID propagation (HTTP filter)
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Per-client sliding-window rate limiting with scheduled eviction of idle clients
 *   <li>CORS configuration for local development
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({ServiceProperties.class, SearchProperties.class})
public class EmployeeSearchApplication {

    private static final Logger log = LoggerFactory.getLogger(EmployeeSearchApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(EmployeeSearchApplication.class, args);
        log.info("Employee search service started successfully");
    }
}
