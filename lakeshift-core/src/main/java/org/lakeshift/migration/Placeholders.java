package org.lakeshift.migration;

/**
 * Catalog and schema tokens written into generated migrations and resolved only when a
 * migration is applied.
 */
public final class Placeholders {
    public static final String CATALOG = "${catalog}";
    public static final String SCHEMA = "${schema}";

    private Placeholders() {
    }

    /**
     * Plain textual replacement. Catalog and schema are identifiers, so nothing is escaped.
     */
    public static String substitute(String sql, String catalog, String schema) {
        return sql.replace(CATALOG, catalog).replace(SCHEMA, schema);
    }
}
