package com.hrsearch.employeesearch.domain;

import com.hrsearch.directory.SearchCriteria;
import java.util.List;

/**
 * Transport-neutral input to {@link EmployeeSearchService#search(SearchRequest)}.
 *
 * @param organizationId organization to search; required
 * @param name optional full-name substring
 * @param department optional exact department
 * @param location optional exact location
 * @param position optional exact position
 * @param statuses optional statuses, any of which may match
 * @param clientKey rate-limit bucket of the caller; required
 */
public record SearchRequest(
        String organizationId,
        String name,
        String department,
        String location,
        String position,
        List<String> statuses,
        String clientKey) {

    public SearchRequest {
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId must not be null or blank");
        }
        if (clientKey == null || clientKey.isBlank()) {
            throw new IllegalArgumentException("clientKey must not be null or blank");
        }
        statuses = statuses == null ? List.of() : List.copyOf(statuses);
    }

    public static SearchRequest forOrganization(String organizationId, String clientKey) {
        return new SearchRequest(organizationId, null, null, null, null, List.of(), clientKey);
    }

    public SearchCriteria criteria() {
        return new SearchCriteria(name, department, location, position, statuses);
    }
}
