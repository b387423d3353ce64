package com.hrsearch.directory.visibility;

import com.hrsearch.directory.EmployeeField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Organization id to ordered visible column names.
 * <p>
 * Built once from configuration and immutable afterwards. On construction each column list is
 * de-duplicated (first occurrence wins). Names that match no {@link EmployeeField} are kept, so
 * the policy reflects configuration faithfully, but logged once at WARN; the projector drops
 * them. Null entries are dropped with the same warning.
 */
public final class VisibilityPolicy {

    private static final Logger log = LoggerFactory.getLogger(VisibilityPolicy.class);

    private final Map<String, List<String>> columnsByOrganization;

    public VisibilityPolicy(Map<String, List<String>> columnsByOrganization) {
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        if (columnsByOrganization != null) {
            columnsByOrganization.forEach((organizationId, columns) ->
                    normalized.put(organizationId, normalize(organizationId, columns)));
        }
        this.columnsByOrganization = Collections.unmodifiableMap(normalized);
        log.info("Visibility policy configured for {} organizations: {}",
                normalized.size(), normalized.keySet());
    }

    public ColumnResolution columnsFor(String organizationId) {
        List<String> columns = organizationId == null ? null : columnsByOrganization.get(organizationId);
        if (columns == null) {
            return new ColumnResolution.Unknown(organizationId);
        }
        return new ColumnResolution.Configured(organizationId, columns);
    }

    /** Visible columns, or an empty list when the organization is not configured. */
    public List<String> visibleColumns(String organizationId) {
        return columnsFor(organizationId) instanceof ColumnResolution.Configured configured
                ? configured.columns()
                : List.of();
    }

    public Set<String> organizationIds() {
        return columnsByOrganization.keySet();
    }

    private static List<String> normalize(String organizationId, List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            log.warn("Organization '{}' is configured with no visible columns; its searches return empty records",
                    organizationId);
            return List.of();
        }
        Set<String> distinct = new LinkedHashSet<>();
        List<String> unknown = new ArrayList<>();
        for (String column : columns) {
            if (column == null) {
                unknown.add(null);
            } else if (distinct.add(column) && EmployeeField.fromName(column).isEmpty()) {
                unknown.add(column);
            }
        }
        if (!unknown.isEmpty()) {
            log.warn("Organization '{}' lists unknown columns {}; they will be omitted from results",
                    organizationId, unknown);
        }
        return List.copyOf(distinct);
    }
}
