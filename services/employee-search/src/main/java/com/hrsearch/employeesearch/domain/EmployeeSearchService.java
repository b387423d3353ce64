package com.hrsearch.employeesearch.domain;

import com.hrsearch.directory.Employee;
import com.hrsearch.directory.store.EmployeeStore;
import com.hrsearch.directory.visibility.ColumnProjector;
import com.hrsearch.directory.visibility.ColumnResolution;
import com.hrsearch.directory.visibility.VisibilityPolicy;
import com.hrsearch.observability.MetricFactory;
import com.hrsearch.ratelimit.ClientRateLimiter;
import com.hrsearch.ratelimit.RateLimitDecision;
import com.hrsearch.ratelimit.RateLimiterConfig;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Employee directory search: the boundary every transport calls.
 *
 * <p>Per request, in order:
 *
 * <ol>
 *   <li>the rate limiter admits and records the client atomically, or the request is rejected;
 *   <li>the visibility policy resolves the organization's columns, or the organization is unknown;
 *   <li>the store returns the organization's matching records;
 *   <li>every record is projected to the visible columns before it leaves this class.
 * </ol>
 *
 * <p>Rejected and unknown-organization requests still count against the client's quota.
 */
@Service
public class EmployeeSearchService {

    private static final Logger log = LoggerFactory.getLogger(EmployeeSearchService.class);

    static final String METRIC_REQUESTS = "hrsearch.search.requests";
    static final String METRIC_RESULTS = "hrsearch.search.results";
    static final String METRIC_LATENCY = "hrsearch.search.latency";
    static final String TAG_OUTCOME = "outcome";

    private final ClientRateLimiter rateLimiter;
    private final VisibilityPolicy visibilityPolicy;
    private final EmployeeStore employeeStore;
    private final ColumnProjector projector;
    private final MetricFactory metrics;
    private final Timer latency;

    public EmployeeSearchService(
            ClientRateLimiter rateLimiter,
            VisibilityPolicy visibilityPolicy,
            EmployeeStore employeeStore,
            ColumnProjector projector,
            MetricFactory metrics) {
        this.rateLimiter = rateLimiter;
        this.visibilityPolicy = visibilityPolicy;
        this.employeeStore = employeeStore;
        this.projector = projector;
        this.metrics = metrics;
        this.latency = metrics.timer(METRIC_LATENCY, "Time spent serving admitted searches");
    }

    public SearchOutcome search(SearchRequest request) {
        RateLimitDecision decision = rateLimiter.tryAcquire(request.clientKey());
        if (!decision.allowed()) {
            RateLimiterConfig config = rateLimiter.config();
            log.info(
                    "Rate limit exceeded for client {} ({} requests per {}s), retry after {}s",
                    request.clientKey(),
                    config.maxRequests(),
                    config.windowSeconds(),
                    decision.retryAfterSeconds());
            count("rate_limited");
            return new SearchOutcome.RateLimited(
                    config.maxRequests(), config.windowSeconds(), decision.retryAfterSeconds());
        }

        ColumnResolution resolution = visibilityPolicy.columnsFor(request.organizationId());
        if (!(resolution instanceof ColumnResolution.Configured configured)) {
            log.info("Search for unconfigured organization '{}'", request.organizationId());
            count("unknown_organization");
            return new SearchOutcome.UnknownOrganization(request.organizationId());
        }

        return latency.record(() -> {
            List<Employee> matches = employeeStore.search(request.organizationId(), request.criteria());
            List<Map<String, Object>> projected = projector.projectAll(matches, configured.columns());
            log.debug(
                    "Search in organization '{}' matched {} records",
                    request.organizationId(),
                    projected.size());
            count("admitted");
            metrics.counter(
                            METRIC_RESULTS,
                            "Records returned by admitted searches",
                            MetricFactory.TAG_ORGANIZATION,
                            request.organizationId())
                    .increment(projected.size());
            return new SearchOutcome.Admitted(projected);
        });
    }

    private void count(String outcome) {
        metrics.counter(METRIC_REQUESTS, "Search requests by outcome", TAG_OUTCOME, outcome)
                .increment();
    }
}
