package org.lakeshift.schema;

import java.util.Locale;

/**
 * One difference between a declared table and its live counterpart.
 *
 * @param column null for table-level issues
 */
public record ValidationIssue(String table, String column, Kind kind, String message) {

    public enum Kind {
        MISSING_TABLE,
        MISSING_COLUMN,
        TYPE_MISMATCH,
        CONSTRAINT_MISMATCH;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
