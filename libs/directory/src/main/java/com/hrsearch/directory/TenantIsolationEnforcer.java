package com.hrsearch.directory;

import java.util.List;

/**
 * Re-checks that records handed out for an organization really belong to it.
 * <p>
 * The store already partitions by organization; this is the last gate before records are
 * projected and returned.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * @throws TenantMismatchException if the record belongs to a different organization
     */
    public static void enforce(String organizationId, Employee employee) {
        if (!organizationId.equals(employee.organizationId())) {
            throw new TenantMismatchException(organizationId, employee.organizationId());
        }
    }

    public static List<Employee> enforceAll(String organizationId, List<Employee> employees) {
        for (Employee employee : employees) {
            enforce(organizationId, employee);
        }
        return employees;
    }
}
