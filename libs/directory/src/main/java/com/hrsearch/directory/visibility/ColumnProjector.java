package com.hrsearch.directory.visibility;

import com.hrsearch.directory.Employee;
import com.hrsearch.directory.EmployeeField;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shapes an employee into an ordered map holding only the permitted columns.
 * <p>
 * Keys appear in column order. Names with no matching field are skipped. A field whose value
 * is null is still emitted, with a null value.
 */
public final class ColumnProjector {

    public Map<String, Object> project(Employee employee, List<String> columns) {
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String column : columns) {
            Optional<EmployeeField> field = EmployeeField.fromName(column);
            if (field.isPresent() && !projected.containsKey(column)) {
                projected.put(column, field.get().read(employee));
            }
        }
        return projected;
    }

    public List<Map<String, Object>> projectAll(List<Employee> employees, List<String> columns) {
        return employees.stream()
                .map(employee -> project(employee, columns))
                .toList();
    }
}
