package com.hrsearch.directory;

/**
 * Thrown when a record of one organization surfaces in a search scoped to another.
 * <p>
 * WHY a RuntimeException: a cross-tenant record is a programming error in the store,
 * not a recoverable condition. Fail fast and loud.
 */
public class TenantMismatchException extends RuntimeException {

    private final String expectedOrganizationId;
    private final String actualOrganizationId;

    public TenantMismatchException(String expectedOrganizationId, String actualOrganizationId) {
        super("Tenant mismatch: search for organization '%s' produced a record of organization '%s'"
                .formatted(expectedOrganizationId, actualOrganizationId));
        this.expectedOrganizationId = expectedOrganizationId;
        this.actualOrganizationId = actualOrganizationId;
    }

    public String expectedOrganizationId() {
        return expectedOrganizationId;
    }

    public String actualOrganizationId() {
        return actualOrganizationId;
    }
}
