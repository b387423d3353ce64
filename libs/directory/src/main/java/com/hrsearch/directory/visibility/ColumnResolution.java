package com.hrsearch.directory.visibility;

import java.util.List;

/**
 * Result of looking up an organization's visible columns.
 * <p>
 * {@link Unknown} (no entry for the organization) and {@link Configured} with an empty list
 * are different answers and callers must not conflate them.
 */
public sealed interface ColumnResolution {

    /** The organization has no visibility configuration. */
    record Unknown(String organizationId) implements ColumnResolution {
    }

    /** Ordered, duplicate-free column names; may be empty. */
    record Configured(String organizationId, List<String> columns) implements ColumnResolution {

        public Configured {
            columns = List.copyOf(columns);
        }
    }
}
