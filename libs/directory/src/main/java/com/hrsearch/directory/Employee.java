package com.hrsearch.directory;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Immutable employee record. Belongs to exactly one organization for its whole life.
 * <p>
 * {@code phone} is optional; every other field is expected to be present in the data file
 * but is not validated beyond {@code id} and {@code organizationId}.
 * {@code salary} is sensitive and only leaves the directory when an organization's visibility
 * policy names it explicitly.
 */
public record Employee(
        @JsonProperty("id") String id,
        @JsonProperty("organization_id") String organizationId,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        @JsonProperty("email") String email,
        @JsonProperty("phone") String phone,
        @JsonProperty("department") String department,
        @JsonProperty("location") String location,
        @JsonProperty("position") String position,
        @JsonProperty("status") String status,
        @JsonProperty("salary") BigDecimal salary
) {

    /** {@code "<first_name> <last_name>"}, the string name filters match against. */
    public String fullName() {
        return firstName + " " + lastName;
    }
}
