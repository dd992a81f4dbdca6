package org.lakeshift.migration.dialect.databricks;

import org.lakeshift.migration.Placeholders;
import org.lakeshift.migration.spi.dialect.DdlDialect;
import org.lakeshift.model.CheckConstraintModel;
import org.lakeshift.model.ColumnModel;
import org.lakeshift.model.ForeignKeyModel;
import org.lakeshift.model.PrimaryKeyModel;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.lakeshift.migration.dialect.databricks.DatabricksUtil.hasText;

/**
 * Databricks SQL for Delta tables. Table names are always qualified with the catalog and
 * schema placeholders.
 */
public class DatabricksDialect implements DdlDialect {

    static final String OPTIMIZE_NOTE = "-- Note: Run OPTIMIZE to apply clustering changes";

    @Override
    public String tableReference(String table) {
        return Placeholders.CATALOG + "." + Placeholders.SCHEMA + "." + table;
    }

    @Override
    public String quoteLiteral(String value) {
        return "'" + DatabricksUtil.escapeLiteral(value) + "'";
    }

    @Override
    public String openCreateTable(String table) {
        return "CREATE TABLE IF NOT EXISTS " + tableReference(table) + " (\n";
    }

    @Override
    public String closeCreateTable() {
        return "\n) USING DELTA";
    }

    @Override
    public String getDropTableSql(String table) {
        // 실행되지 않도록 주석으로만 출력
        return "-- DROP TABLE IF EXISTS " + tableReference(table) + ";";
    }

    @Override
    public String getColumnDefinitionSql(ColumnModel column) {
        StringBuilder sb = new StringBuilder(column.getName()).append(' ').append(column.getType());
        if (hasText(column.getGenerated())) {
            sb.append(" GENERATED ").append(column.getGenerated());
        }
        if (!column.isNullable()) {
            sb.append(" NOT NULL");
        }
        appendDefaultAndComment(sb, column);
        return sb.toString();
    }

    @Override
    public String getAddColumnSql(String table, ColumnModel column) {
        StringBuilder sb = new StringBuilder(column.getName()).append(' ').append(column.getType());
        if (!column.isNullable()) {
            sb.append(" NOT NULL");
        }
        appendDefaultAndComment(sb, column);
        return alterTable(table) + " ADD COLUMN IF NOT EXISTS " + sb + ";";
    }

    private void appendDefaultAndComment(StringBuilder sb, ColumnModel column) {
        if (hasText(column.getDefaultValue())) {
            sb.append(" DEFAULT ").append(column.getDefaultValue());
        }
        if (hasText(column.getComment())) {
            sb.append(" COMMENT ").append(quoteLiteral(column.getComment()));
        }
    }

    @Override
    public String getDropColumnSql(String table, String column) {
        return alterTable(table) + " DROP COLUMN IF EXISTS " + column + ";";
    }

    @Override
    public String getAlterColumnTypeSql(String table, String column, String type) {
        return alterColumn(table, column) + " TYPE " + type + ";";
    }

    @Override
    public String getAlterColumnNullabilitySql(String table, String column, boolean nullable) {
        return alterColumn(table, column) + (nullable ? " DROP NOT NULL;" : " SET NOT NULL;");
    }

    @Override
    public String getAlterColumnDefaultSql(String table, String column, String defaultValue) {
        return hasText(defaultValue)
                ? alterColumn(table, column) + " SET DEFAULT " + defaultValue + ";"
                : alterColumn(table, column) + " DROP DEFAULT;";
    }

    @Override
    public String getPrimaryKeyDefinitionSql(String table, PrimaryKeyModel primaryKey) {
        return "CONSTRAINT pk_" + table + " PRIMARY KEY (" + String.join(", ", primaryKey.getColumns()) + ")"
                + (primaryKey.isRely() ? " RELY" : " NORELY");
    }

    @Override
    public String getAddPrimaryKeySql(String table, PrimaryKeyModel primaryKey) {
        return alterTable(table) + " ADD " + getPrimaryKeyDefinitionSql(table, primaryKey) + ";";
    }

    @Override
    public String getDropPrimaryKeySql(String table) {
        return alterTable(table) + " DROP PRIMARY KEY IF EXISTS;";
    }

    @Override
    public String getAddForeignKeySql(String table, String column, ForeignKeyModel foreignKey) {
        return alterTable(table) + " ADD CONSTRAINT " + foreignKeyName(table, column)
                + " FOREIGN KEY (" + column + ") REFERENCES " + tableReference(foreignKey.getTable())
                + " (" + foreignKey.getColumn() + ");";
    }

    @Override
    public String getDropForeignKeySql(String table, String column) {
        return alterTable(table) + " DROP CONSTRAINT IF EXISTS " + foreignKeyName(table, column) + ";";
    }

    @Override
    public String getAddCheckConstraintSql(String table, CheckConstraintModel constraint) {
        return alterTable(table) + " ADD CONSTRAINT " + constraint.getName()
                + " CHECK (" + constraint.getExpression() + ");";
    }

    @Override
    public String getDropCheckConstraintSql(String table, String constraintName) {
        return alterTable(table) + " DROP CONSTRAINT IF EXISTS " + constraintName + ";";
    }

    @Override
    public String getClusterByClause(List<String> columns) {
        return "CLUSTER BY (" + String.join(", ", columns) + ")";
    }

    @Override
    public String getPartitionedByClause(List<String> columns) {
        return "PARTITIONED BY (" + String.join(", ", columns) + ")";
    }

    @Override
    public String getTablePropertiesClause(Map<String, String> properties) {
        return "TBLPROPERTIES (" + propertyList(properties) + ")";
    }

    @Override
    public String getTableCommentClause(String comment) {
        return "COMMENT " + quoteLiteral(comment);
    }

    @Override
    public String getAlterClusteringSql(String table, List<String> columns) {
        String clause = columns.isEmpty() ? "CLUSTER BY NONE" : getClusterByClause(columns);
        return alterTable(table) + " " + clause + ";\n" + OPTIMIZE_NOTE;
    }

    @Override
    public String getSetTablePropertiesSql(String table, Map<String, String> properties) {
        return alterTable(table) + " SET TBLPROPERTIES (" + propertyList(properties) + ");";
    }

    private String propertyList(Map<String, String> properties) {
        return properties.entrySet().stream()
                .map(e -> quoteLiteral(e.getKey()) + " = " + quoteLiteral(String.valueOf(e.getValue())))
                .collect(Collectors.joining(", "));
    }

    private String alterTable(String table) {
        return "ALTER TABLE " + tableReference(table);
    }

    private String alterColumn(String table, String column) {
        return alterTable(table) + " ALTER COLUMN " + column;
    }

    static String foreignKeyName(String table, String column) {
        return "fk_" + table + "_" + column;
    }
}
