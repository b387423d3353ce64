package com.hrsearch.employeesearch.infrastructure.web;

import com.hrsearch.employeesearch.domain.SearchOutcome;

/**
 * Raised by the HTTP layer for a {@link SearchOutcome.RateLimited} outcome so the 429 response is
 * rendered by {@link GlobalExceptionHandler} like every other problem.
 */
public class RateLimitExceededException extends RuntimeException {

    private final transient SearchOutcome.RateLimited outcome;

    public RateLimitExceededException(SearchOutcome.RateLimited outcome) {
        super(
                "Too many requests. Please try again after %d seconds. Limit is %d requests per %d seconds."
                        .formatted(
                                outcome.windowSeconds(),
                                outcome.maxRequests(),
                                outcome.windowSeconds()));
        this.outcome = outcome;
    }

    public SearchOutcome.RateLimited outcome() {
        return outcome;
    }
}
