package com.hrsearch.employeesearch.domain;

import java.util.List;
import java.util.Map;

/**
 * Result of a search. Exactly one of three variants; transports map each to their own response.
 */
public sealed interface SearchOutcome {

    /** Projected records, one ordered map per matching employee. */
    record Admitted(List<Map<String, Object>> employees) implements SearchOutcome {

        public Admitted {
            employees = List.copyOf(employees);
        }
    }

    /** The client exhausted its quota; {@code retryAfterSeconds} is at least 1. */
    record RateLimited(int maxRequests, long windowSeconds, long retryAfterSeconds)
            implements SearchOutcome {}

    /** The organization has no visibility configuration. */
    record UnknownOrganization(String organizationId) implements SearchOutcome {}
}
