package org.lakeshift.migration.spi.dialect;

import org.lakeshift.model.CheckConstraintModel;
import org.lakeshift.model.ColumnModel;
import org.lakeshift.model.ForeignKeyModel;
import org.lakeshift.model.PrimaryKeyModel;

import java.util.List;
import java.util.Map;

public interface DdlDialect {
    // Names & literals
    String tableReference(String table);
    String quoteLiteral(String value);

    // Table
    String openCreateTable(String table);
    String closeCreateTable();
    String getDropTableSql(String table);

    // Column
    String getColumnDefinitionSql(ColumnModel column);
    String getAddColumnSql(String table, ColumnModel column);
    String getDropColumnSql(String table, String column);
    String getAlterColumnTypeSql(String table, String column, String type);
    String getAlterColumnNullabilitySql(String table, String column, boolean nullable);
    String getAlterColumnDefaultSql(String table, String column, String defaultValue);

    // Primary Key
    String getPrimaryKeyDefinitionSql(String table, PrimaryKeyModel primaryKey);
    String getAddPrimaryKeySql(String table, PrimaryKeyModel primaryKey);
    String getDropPrimaryKeySql(String table);

    // Foreign Key (informational)
    String getAddForeignKeySql(String table, String column, ForeignKeyModel foreignKey);
    String getDropForeignKeySql(String table, String column);

    // Check constraints
    String getAddCheckConstraintSql(String table, CheckConstraintModel constraint);
    String getDropCheckConstraintSql(String table, String constraintName);

    // Layout & properties
    String getClusterByClause(List<String> columns);
    String getPartitionedByClause(List<String> columns);
    String getTablePropertiesClause(Map<String, String> properties);
    String getTableCommentClause(String comment);
    String getAlterClusteringSql(String table, List<String> columns);
    String getSetTablePropertiesSql(String table, Map<String, String> properties);
}
