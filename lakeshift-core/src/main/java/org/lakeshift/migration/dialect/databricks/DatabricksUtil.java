package org.lakeshift.migration.dialect.databricks;

public final class DatabricksUtil {
    private DatabricksUtil() {
    }

    /** Doubles embedded single quotes: {@code it's} becomes {@code it''s}. */
    public static String escapeLiteral(String value) {
        return value.replace("'", "''");
    }

    static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
