package com.hrsearch.directory.store;

import com.hrsearch.directory.Employee;
import com.hrsearch.directory.SearchCriteria;

import java.util.List;

/**
 * Read-only, organization-scoped access to employee records.
 */
public interface EmployeeStore {

    /**
     * Records of {@code organizationId} (exact, case-sensitive) that satisfy every present filter
     * of {@code criteria}, in insertion order. Never returns a record of another organization.
     */
    List<Employee> search(String organizationId, SearchCriteria criteria);

    int size();

    /** Organizations that own at least one record. */
    List<String> organizationIds();
}
