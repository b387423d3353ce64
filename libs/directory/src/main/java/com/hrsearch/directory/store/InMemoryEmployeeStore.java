package com.hrsearch.directory.store;

import com.hrsearch.directory.Employee;
import com.hrsearch.directory.SearchCriteria;
import com.hrsearch.directory.TenantIsolationEnforcer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable store holding records partitioned by organization.
 * <p>
 * The organization restriction is a map lookup, so criteria predicates only ever see the
 * caller's partition. Safe for concurrent reads without locking.
 */
public final class InMemoryEmployeeStore implements EmployeeStore {

    private final Map<String, List<Employee>> byOrganization;
    private final int size;

    /**
     * @throws IllegalStateException on a duplicate id or a blank organization id
     */
    public InMemoryEmployeeStore(Collection<Employee> employees) {
        Objects.requireNonNull(employees, "employees cannot be null");
        Map<String, List<Employee>> partitions = new LinkedHashMap<>();
        Set<String> ids = new HashSet<>();
        for (Employee employee : employees) {
            if (employee.id() == null || employee.id().isBlank()) {
                throw new IllegalStateException("Employee record without id");
            }
            if (employee.organizationId() == null || employee.organizationId().isBlank()) {
                throw new IllegalStateException("Employee '%s' has no organization_id".formatted(employee.id()));
            }
            if (!ids.add(employee.id())) {
                throw new IllegalStateException("Duplicate employee id '%s'".formatted(employee.id()));
            }
            partitions.computeIfAbsent(employee.organizationId(), k -> new ArrayList<>()).add(employee);
        }
        Map<String, List<Employee>> frozen = new LinkedHashMap<>();
        partitions.forEach((org, list) -> frozen.put(org, List.copyOf(list)));
        this.byOrganization = Collections.unmodifiableMap(frozen);
        this.size = ids.size();
    }

    @Override
    public List<Employee> search(String organizationId, SearchCriteria criteria) {
        if (organizationId == null) {
            throw new IllegalArgumentException("organizationId cannot be null");
        }
        SearchCriteria effective = criteria == null ? SearchCriteria.none() : criteria;
        List<Employee> partition = byOrganization.getOrDefault(organizationId, List.of());
        List<Employee> matches = partition.stream()
                .filter(effective::matches)
                .toList();
        return TenantIsolationEnforcer.enforceAll(organizationId, matches);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public List<String> organizationIds() {
        return List.copyOf(byOrganization.keySet());
    }
}
