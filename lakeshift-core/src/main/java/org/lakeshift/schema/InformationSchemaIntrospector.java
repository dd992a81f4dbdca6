package org.lakeshift.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.lakeshift.client.SqlClient;
import org.lakeshift.exception.IntrospectionException;
import org.lakeshift.exception.LakeshiftException;
import org.lakeshift.migration.dialect.databricks.DatabricksIdentifierPolicy;
import org.lakeshift.migration.dialect.databricks.DatabricksUtil;
import org.lakeshift.model.CheckConstraintModel;
import org.lakeshift.model.ColumnModel;
import org.lakeshift.model.ForeignKeyModel;
import org.lakeshift.model.PrimaryKeyModel;
import org.lakeshift.model.SchemaModel;
import org.lakeshift.model.TableModel;

import java.sql.Array;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link SchemaModel} from Unity Catalog {@code information_schema} views,
 * {@code SHOW TBLPROPERTIES} and {@code DESCRIBE DETAIL}.
 * <p>
 * Tables whose name starts with {@code _} are internal (e.g. the migration state table) and
 * are skipped. Only the table properties lakeshift manages are kept.
 */
@Slf4j
public class InformationSchemaIntrospector implements SchemaIntrospector {
    static final String CONSTRAINT_PROPERTY_PREFIX = "delta.constraints.";
    static final List<String> KEPT_PROPERTY_PREFIXES = List.of(
            "delta.enableChangeDataFeed",
            "delta.autoOptimize",
            "delta.columnMapping",
            "delta.minReaderVersion",
            "delta.minWriterVersion"
    );

    private final SqlClient client;
    private final String catalog;
    private final String schema;
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public InformationSchemaIntrospector(SqlClient client, String catalog, String schema) {
        DatabricksIdentifierPolicy policy = new DatabricksIdentifierPolicy();
        this.client = client;
        this.catalog = policy.requireValid("catalog", catalog);
        this.schema = policy.requireValid("schema", schema);
    }

    @Override
    public SchemaModel introspect() {
        try {
            List<TableModel> tables = new ArrayList<>();
            for (String tableName : tableNames()) {
                tables.add(introspectTable(tableName));
            }
            log.debug("Introspected {} tables from {}.{}", tables.size(), catalog, schema);
            return SchemaModel.of(tables);
        } catch (IntrospectionException e) {
            throw e;
        } catch (LakeshiftException | IllegalStateException | ClassCastException e) {
            throw new IntrospectionException("Failed to introspect " + catalog + "." + schema + ": " + e.getMessage(), e);
        }
    }

    List<String> tableNames() {
        String sql = "SELECT table_name FROM " + catalog + ".information_schema.tables"
                + " WHERE table_schema = " + literal(schema)
                + " AND table_type IN ('MANAGED', 'EXTERNAL')"
                + " ORDER BY table_name";
        return client.fetchAll(sql).stream()
                .map(row -> (String) row.get("table_name"))
                .filter(name -> !name.startsWith("_"))
                .toList();
    }

    TableModel introspectTable(String tableName) {
        Map<String, String> rawProperties = tableProperties(tableName);
        Map<String, Object> detail = describeDetail(tableName);

        return TableModel.builder()
                .name(tableName)
                .columns(columns(tableName))
                .primaryKey(primaryKey(tableName))
                .checkConstraints(checkConstraints(rawProperties))
                .liquidClustering(stringList(detail.get("clusteringcolumns"), tableName))
                .partitionedBy(stringList(detail.get("partitioncolumns"), tableName))
                .tableProperties(keptProperties(rawProperties))
                .build();
    }

    private List<ColumnModel> columns(String tableName) {
        Map<String, ForeignKeyModel> foreignKeys = foreignKeys(tableName);
        String sql = "SELECT column_name, full_data_type, is_nullable, column_default, comment"
                + " FROM " + catalog + ".information_schema.columns"
                + " WHERE table_schema = " + literal(schema)
                + " AND table_name = " + literal(tableName)
                + " ORDER BY ordinal_position";
        List<ColumnModel> columns = new ArrayList<>();
        for (Map<String, Object> row : client.fetchAll(sql)) {
            String name = (String) row.get("column_name");
            columns.add(ColumnModel.builder()
                    .name(name)
                    .type((String) row.get("full_data_type"))
                    .nullable("YES".equals(row.get("is_nullable")))
                    .defaultValue((String) row.get("column_default"))
                    .comment((String) row.get("comment"))
                    .foreignKey(foreignKeys.get(name))
                    .build());
        }
        return columns;
    }

    private PrimaryKeyModel primaryKey(String tableName) {
        String sql = "SELECT tc.constraint_name, tc.enforced, kcu.column_name, kcu.ordinal_position"
                + " FROM " + catalog + ".information_schema.table_constraints tc"
                + " JOIN " + catalog + ".information_schema.key_column_usage kcu"
                + " ON tc.constraint_catalog = kcu.constraint_catalog"
                + " AND tc.constraint_schema = kcu.constraint_schema"
                + " AND tc.constraint_name = kcu.constraint_name"
                + " WHERE tc.table_schema = " + literal(schema)
                + " AND tc.table_name = " + literal(tableName)
                + " AND tc.constraint_type = 'PRIMARY KEY'"
                + " ORDER BY kcu.ordinal_position";
        List<Map<String, Object>> rows = client.fetchAll(sql);
        if (rows.isEmpty()) {
            return null;
        }
        List<String> columns = rows.stream().map(r -> (String) r.get("column_name")).toList();
        // information_schema에는 RELY 컬럼이 없어 enforced 값으로 판단
        boolean rely = "YES".equals(rows.get(0).get("enforced"));
        return PrimaryKeyModel.of(columns, rely);
    }

    private Map<String, ForeignKeyModel> foreignKeys(String tableName) {
        String sql = "SELECT kcu.column_name, ccu.table_name AS referenced_table, ccu.column_name AS referenced_column"
                + " FROM " + catalog + ".information_schema.referential_constraints rc"
                + " JOIN " + catalog + ".information_schema.key_column_usage kcu"
                + " ON rc.constraint_catalog = kcu.constraint_catalog"
                + " AND rc.constraint_schema = kcu.constraint_schema"
                + " AND rc.constraint_name = kcu.constraint_name"
                + " JOIN " + catalog + ".information_schema.constraint_column_usage ccu"
                + " ON rc.unique_constraint_catalog = ccu.constraint_catalog"
                + " AND rc.unique_constraint_schema = ccu.constraint_schema"
                + " AND rc.unique_constraint_name = ccu.constraint_name"
                + " WHERE kcu.table_schema = " + literal(schema)
                + " AND kcu.table_name = " + literal(tableName);
        Map<String, ForeignKeyModel> byColumn = new HashMap<>();
        for (Map<String, Object> row : client.fetchAll(sql)) {
            byColumn.putIfAbsent((String) row.get("column_name"), ForeignKeyModel.of(
                    (String) row.get("referenced_table"), (String) row.get("referenced_column")));
        }
        return byColumn;
    }

    private Map<String, String> tableProperties(String tableName) {
        Map<String, String> properties = new LinkedHashMap<>();
        for (Map<String, Object> row : client.fetchAll("SHOW TBLPROPERTIES " + fqn(tableName))) {
            properties.put(String.valueOf(row.get("key")), String.valueOf(row.get("value")));
        }
        return properties;
    }

    private List<CheckConstraintModel> checkConstraints(Map<String, String> rawProperties) {
        List<CheckConstraintModel> checks = new ArrayList<>();
        rawProperties.forEach((key, value) -> {
            if (key.startsWith(CONSTRAINT_PROPERTY_PREFIX)) {
                checks.add(CheckConstraintModel.of(key.substring(CONSTRAINT_PROPERTY_PREFIX.length()), value));
            }
        });
        return checks;
    }

    private Map<String, String> keptProperties(Map<String, String> rawProperties) {
        Map<String, String> kept = new LinkedHashMap<>();
        rawProperties.forEach((key, value) -> {
            if (KEPT_PROPERTY_PREFIXES.stream().anyMatch(key::startsWith)) {
                kept.put(key, value);
            }
        });
        return kept;
    }

    private Map<String, Object> describeDetail(String tableName) {
        List<Map<String, Object>> rows = client.fetchAll("DESCRIBE DETAIL " + fqn(tableName));
        return rows.isEmpty() ? Map.of() : rows.get(0);
    }

    /**
     * Array columns arrive as a JDBC {@link Array}, a {@link List} or a JSON string depending
     * on the driver.
     */
    List<String> stringList(Object value, String tableName) {
        if (value == null) {
            return new ArrayList<>();
        }
        if (value instanceof List<?> list) {
            return new ArrayList<>(list.stream().map(String::valueOf).toList());
        }
        if (value instanceof Array array) {
            try {
                Object[] items = (Object[]) array.getArray();
                List<String> result = new ArrayList<>();
                for (Object item : items) {
                    result.add(String.valueOf(item));
                }
                return result;
            } catch (SQLException e) {
                throw new IntrospectionException("Failed to read DESCRIBE DETAIL of " + tableName, e);
            }
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(jsonMapper.readValue(text, new TypeReference<List<String>>() {}));
        } catch (Exception e) {
            throw new IntrospectionException("Unexpected DESCRIBE DETAIL value for " + tableName + ": " + text, e);
        }
    }

    private String fqn(String tableName) {
        return catalog + "." + schema + "." + tableName;
    }

    private static String literal(String value) {
        return "'" + DatabricksUtil.escapeLiteral(value) + "'";
    }
}
