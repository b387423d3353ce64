package com.hrsearch.directory.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hrsearch.directory.Employee;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Reads the employee data file (a JSON array of records with snake_case keys) into a store.
 * <p>
 * Runs once at startup. Any problem with the file aborts startup.
 */
public final class EmployeeDataLoader {

    private static final Logger log = LoggerFactory.getLogger(EmployeeDataLoader.class);

    private static final TypeReference<List<Employee>> EMPLOYEE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public EmployeeDataLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public EmployeeDataLoader() {
        this(new ObjectMapper());
    }

    /**
     * @param input       the JSON document; closed by this method
     * @param description where the document came from, for log and error messages
     * @throws UncheckedIOException  if the document cannot be read or parsed
     * @throws IllegalStateException if records are inconsistent (duplicate id, blank organization)
     */
    public InMemoryEmployeeStore load(InputStream input, String description) {
        List<Employee> employees;
        try (InputStream in = input) {
            employees = objectMapper.readValue(in, EMPLOYEE_LIST);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read employee data from " + description, e);
        }
        if (employees == null) {
            throw new IllegalStateException("Employee data in " + description + " is empty");
        }
        InMemoryEmployeeStore store = new InMemoryEmployeeStore(employees);
        log.info("Loaded {} employees across {} organizations from {}",
                store.size(), store.organizationIds().size(), description);
        return store;
    }
}
