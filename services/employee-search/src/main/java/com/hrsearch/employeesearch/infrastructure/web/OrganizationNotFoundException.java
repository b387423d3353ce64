package com.hrsearch.employeesearch.infrastructure.web;

/** Raised by the HTTP layer for an unknown-organization outcome; rendered as 404. */
public class OrganizationNotFoundException extends RuntimeException {

    private final String organizationId;

    public OrganizationNotFoundException(String organizationId) {
        super("Organization '%s' not found or no display columns configured."
                .formatted(organizationId));
        this.organizationId = organizationId;
    }

    public String organizationId() {
        return organizationId;
    }
}
