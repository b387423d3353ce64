package com.hrsearch.directory;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Externally visible employee fields, keyed by their snake_case names.
 * <p>
 * This is the only place that maps a configured column name to a value on {@link Employee}.
 * Column names that do not resolve here are dropped from projections.
 */
public enum EmployeeField {

    ID("id", Employee::id),
    ORGANIZATION_ID("organization_id", Employee::organizationId),
    FIRST_NAME("first_name", Employee::firstName),
    LAST_NAME("last_name", Employee::lastName),
    EMAIL("email", Employee::email),
    PHONE("phone", Employee::phone),
    DEPARTMENT("department", Employee::department),
    LOCATION("location", Employee::location),
    POSITION("position", Employee::position),
    STATUS("status", Employee::status),
    SALARY("salary", Employee::salary);

    private static final Map<String, EmployeeField> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EmployeeField::fieldName, Function.identity()));

    private final String fieldName;
    private final Function<Employee, Object> reader;

    EmployeeField(String fieldName, Function<Employee, Object> reader) {
        this.fieldName = fieldName;
        this.reader = reader;
    }

    public String fieldName() {
        return fieldName;
    }

    /** Value of this field on the given record; may be null (e.g. a missing phone). */
    public Object read(Employee employee) {
        return reader.apply(employee);
    }

    /** Exact, case-sensitive lookup by snake_case name. */
    public static Optional<EmployeeField> fromName(String name) {
        return Optional.ofNullable(name).map(BY_NAME::get);
    }
}
