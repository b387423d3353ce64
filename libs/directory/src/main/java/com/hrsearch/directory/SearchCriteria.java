package com.hrsearch.directory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Optional filters for a directory search. All present filters must match (logical AND).
 * <p>
 * Null, empty and whitespace-only values are normalized to "absent" on construction, as are
 * blank entries of {@code statuses}. An empty status list imposes no constraint.
 *
 * @param name       case-insensitive substring of {@code "<first_name> <last_name>"}
 * @param department case-insensitive exact match
 * @param location   case-insensitive exact match
 * @param position   case-insensitive exact match
 * @param statuses   case-insensitive exact match against any one value
 */
public record SearchCriteria(
        String name,
        String department,
        String location,
        String position,
        List<String> statuses
) {

    private static final SearchCriteria NONE = new SearchCriteria(null, null, null, null, List.of());

    public SearchCriteria {
        name = blankToNull(name);
        department = blankToNull(department);
        location = blankToNull(location);
        position = blankToNull(position);
        statuses = statuses == null ? List.of() : statuses.stream()
                .map(SearchCriteria::blankToNull)
                .filter(Objects::nonNull)
                .toList();
    }

    public static SearchCriteria none() {
        return NONE;
    }

    public boolean matches(Employee employee) {
        if (name != null && !containsIgnoreCase(employee.fullName(), name)) {
            return false;
        }
        if (department != null && !department.equalsIgnoreCase(employee.department())) {
            return false;
        }
        if (location != null && !location.equalsIgnoreCase(employee.location())) {
            return false;
        }
        if (position != null && !position.equalsIgnoreCase(employee.position())) {
            return false;
        }
        return statuses.isEmpty() || statuses.stream().anyMatch(s -> s.equalsIgnoreCase(employee.status()));
    }

    private static boolean containsIgnoreCase(String haystack, String needle) {
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
