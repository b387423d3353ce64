package com.hrsearch.employeesearch.infrastructure.ratelimit;

import com.hrsearch.employeesearch.config.SearchProperties;
import com.hrsearch.observability.CorrelationContext;
import com.hrsearch.observability.CorrelationContextHolder;
import com.hrsearch.observability.MetricFactory;
import com.hrsearch.ratelimit.SlidingWindowRateLimiter;
import io.micrometer.core.instrument.Counter;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

/**
 * Periodically drops rate-limiter keys whose window has fully expired, bounding memory by the
 * number of clients seen within roughly one window plus one sweep interval.
 *
 * <p>Registered with Spring's scheduler at the configured
 * {@code hrsearch.search.rate-limit.eviction-interval}.
 */
@Component
public class RateLimiterEvictionTask implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterEvictionTask.class);

    private final SlidingWindowRateLimiter rateLimiter;
    private final Duration interval;
    private final Counter evictions;

    public RateLimiterEvictionTask(
            SlidingWindowRateLimiter rateLimiter, SearchProperties properties, MetricFactory metrics) {
        this.rateLimiter = rateLimiter;
        this.interval = properties.rateLimit().evictionInterval();
        this.evictions =
                metrics.counter("hrsearch.ratelimit.evictions", "Idle client keys evicted");
        metrics.gauge(
                "hrsearch.ratelimit.tracked_keys",
                "Client keys currently holding a rate-limit window",
                rateLimiter::trackedKeys);
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        log.info("Scheduling rate-limit key eviction every {}", interval);
        registrar.addFixedDelayTask(this::sweep, interval);
    }

    /** Runs one eviction pass; returns the number of keys removed. */
    public int sweep() {
        int[] evicted = new int[1];
        CorrelationContextHolder.runWithContext(
                CorrelationContext.of("ratelimit-eviction"),
                () -> {
                    evicted[0] = rateLimiter.evictIdle();
                    evictions.increment(evicted[0]);
                    if (evicted[0] > 0) {
                        log.info(
                                "Evicted {} idle client keys, {} still tracked",
                                evicted[0],
                                rateLimiter.trackedKeys());
                    }
                });
        return evicted[0];
    }
}
