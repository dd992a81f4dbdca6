package org.lakeshift.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;
import org.lakeshift.exception.SchemaLoadException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Declared or observed definition of one Delta table.
 * <p>
 * Equality is semantic rather than structural: columns and check constraints are compared
 * as name-keyed maps, and clustering and partition columns as sets. Clustering order is
 * still kept because it matters when SQL is rendered.
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@ToString
public class TableModel {
    public static final int MAX_CLUSTERING_COLUMNS = 4;
    public static final String COLUMN_MAPPING_MODE_PROPERTY = "delta.columnMapping.mode";

    @JsonProperty("table")
    private final String name;
    @JsonProperty("columns")
    @Builder.Default private final List<ColumnModel> columns = new ArrayList<>();
    @JsonProperty("primary_key")
    private final PrimaryKeyModel primaryKey;
    @JsonProperty("check_constraints")
    @Builder.Default private final List<CheckConstraintModel> checkConstraints = new ArrayList<>();
    @JsonProperty("liquid_clustering")
    @Builder.Default private final List<String> liquidClustering = new ArrayList<>();
    @JsonProperty("partitioned_by")
    @Builder.Default private final List<String> partitionedBy = new ArrayList<>();
    @JsonProperty("table_properties")
    @Builder.Default private final Map<String, String> tableProperties = new LinkedHashMap<>();
    @JsonProperty("comment")
    private final String comment;

    public Optional<ColumnModel> getColumn(String columnName) {
        return columns.stream().filter(c -> c.getName().equals(columnName)).findFirst();
    }

    /**
     * Name-based column mapping is required before columns can be dropped or renamed
     * without rewriting data files.
     */
    public boolean hasColumnMapping() {
        return "name".equals(tableProperties.get(COLUMN_MAPPING_MODE_PROPERTY));
    }

    public Map<String, ColumnModel> columnsByName() {
        Map<String, ColumnModel> byName = new LinkedHashMap<>();
        columns.forEach(c -> byName.put(c.getName(), c));
        return byName;
    }

    public Map<String, CheckConstraintModel> checkConstraintsByName() {
        Map<String, CheckConstraintModel> byName = new LinkedHashMap<>();
        checkConstraints.forEach(c -> byName.put(c.getName(), c));
        return byName;
    }

    /**
     * Enforces the invariants a well-formed table must satisfy before it takes part in a diff.
     *
     * @throws SchemaLoadException on the first violation found
     */
    public TableModel validate() {
        if (isBlank(name)) {
            throw new SchemaLoadException("Table definition missing 'table' field");
        }
        if (columns == null || columns.isEmpty()) {
            throw new SchemaLoadException("Table '" + name + "' must declare at least one column");
        }
        Set<String> seen = new HashSet<>();
        for (ColumnModel column : columns) {
            if (isBlank(column.getName())) {
                throw new SchemaLoadException("Table '" + name + "' has a column without a name");
            }
            if (isBlank(column.getType())) {
                throw new SchemaLoadException("Column '" + name + "." + column.getName() + "' is missing a type");
            }
            if (!seen.add(column.getName())) {
                throw new SchemaLoadException("Duplicate column '" + column.getName() + "' in table '" + name + "'");
            }
        }
        if (liquidClustering.size() > MAX_CLUSTERING_COLUMNS) {
            throw new SchemaLoadException("Table '" + name + "' declares " + liquidClustering.size()
                    + " liquid clustering columns; at most " + MAX_CLUSTERING_COLUMNS + " are allowed");
        }
        if (primaryKey != null && primaryKey.getColumns().isEmpty()) {
            throw new SchemaLoadException("Primary key of table '" + name + "' has no columns");
        }
        for (CheckConstraintModel check : checkConstraints) {
            if (isBlank(check.getName()) || isBlank(check.getExpression())) {
                throw new SchemaLoadException("Check constraint on table '" + name + "' needs both name and expression");
            }
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableModel other)) return false;
        return Objects.equals(name, other.name)
                && columnsByName().equals(other.columnsByName())
                && Objects.equals(primaryKey, other.primaryKey)
                && checkConstraintsByName().equals(other.checkConstraintsByName())
                && new HashSet<>(liquidClustering).equals(new HashSet<>(other.liquidClustering))
                && new HashSet<>(partitionedBy).equals(new HashSet<>(other.partitionedBy))
                && tableProperties.equals(other.tableProperties)
                && Objects.equals(comment, other.comment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columnsByName(), primaryKey, checkConstraintsByName(),
                new HashSet<>(liquidClustering), new HashSet<>(partitionedBy), tableProperties, comment);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
