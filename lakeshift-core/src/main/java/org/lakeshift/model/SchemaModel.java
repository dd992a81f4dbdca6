package org.lakeshift.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A catalog schema: table name to table. No cross-table invariant is enforced, foreign keys
 * are informational.
 */
@EqualsAndHashCode
@ToString
public class SchemaModel {
    private final Map<String, TableModel> tables;

    public SchemaModel(Map<String, TableModel> tables) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public static SchemaModel empty() {
        return new SchemaModel(Map.of());
    }

    public static SchemaModel of(Collection<TableModel> tables) {
        Map<String, TableModel> byName = new LinkedHashMap<>();
        tables.forEach(t -> byName.put(t.getName(), t));
        return new SchemaModel(byName);
    }

    public static SchemaModel of(TableModel... tables) {
        return of(java.util.List.of(tables));
    }

    public Optional<TableModel> getTable(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    public Set<String> tableNames() {
        return tables.keySet();
    }

    public Map<String, TableModel> getTables() {
        return tables;
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }
}
