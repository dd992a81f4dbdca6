package org.lakeshift.migration.dialect.databricks;

import org.lakeshift.exception.CodegenException;
import org.lakeshift.exception.UnsupportedChangeException;
import org.lakeshift.migration.CreateTableBuilder;
import org.lakeshift.migration.spi.dialect.DdlDialect;
import org.lakeshift.migration.spi.visitor.ChangeVisitor;
import org.lakeshift.model.Change;
import org.lakeshift.model.ChangeDetail;
import org.lakeshift.model.ChangeType;
import org.lakeshift.model.ColumnModel;

import java.util.Objects;

/**
 * Renders each change as the SQL of its block in a migration file.
 */
public class DatabricksMigrationVisitor implements ChangeVisitor<String> {
    private final DdlDialect dialect;

    public DatabricksMigrationVisitor() {
        this(new DatabricksDialect());
    }

    public DatabricksMigrationVisitor(DdlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    @Override
    public String visitCreateTable(Change change, ChangeDetail.CreateTable detail) {
        return new CreateTableBuilder(change.getTableName(), dialect)
                .defaultsFrom(detail.table())
                .build();
    }

    @Override
    public String visitDropTable(Change change, ChangeDetail.DropTable detail) {
        return dialect.getDropTableSql(change.getTableName());
    }

    @Override
    public String visitAddColumn(Change change, ChangeDetail.AddColumn detail) {
        ColumnModel column = detail.column();
        // 기존 row 때문에 default 없는 NOT NULL 컬럼은 추가 불가
        if (!column.isNullable() && !DatabricksUtil.hasText(column.getDefaultValue())) {
            throw new CodegenException("Cannot add non-nullable column '" + column.getName() + "' without a default.");
        }
        return dialect.getAddColumnSql(change.getTableName(), column);
    }

    @Override
    public String visitDropColumn(Change change, ChangeDetail.DropColumn detail) {
        return dialect.getDropColumnSql(change.getTableName(), detail.columnName());
    }

    @Override
    public String visitAlterColumnType(Change change, ChangeDetail.AlterColumnType detail) {
        return dialect.getAlterColumnTypeSql(change.getTableName(), detail.columnName(), detail.toType());
    }

    @Override
    public String visitAlterColumnNullability(Change change, ChangeDetail.AlterColumnNullability detail) {
        return dialect.getAlterColumnNullabilitySql(change.getTableName(), detail.columnName(), detail.toNullable());
    }

    @Override
    public String visitAlterColumnDefault(Change change, ChangeDetail.AlterColumnDefault detail) {
        return dialect.getAlterColumnDefaultSql(change.getTableName(), detail.columnName(), detail.toDefault());
    }

    @Override
    public String visitSetPrimaryKey(Change change, ChangeDetail.SetPrimaryKey detail) {
        return dialect.getAddPrimaryKeySql(change.getTableName(), detail.primaryKey());
    }

    @Override
    public String visitDropPrimaryKey(Change change, ChangeDetail.DropPrimaryKey detail) {
        return dialect.getDropPrimaryKeySql(change.getTableName());
    }

    @Override
    public String visitAddForeignKey(Change change, ChangeDetail.AddForeignKey detail) {
        return dialect.getAddForeignKeySql(change.getTableName(), detail.columnName(), detail.foreignKey());
    }

    @Override
    public String visitDropForeignKey(Change change, ChangeDetail.DropForeignKey detail) {
        return dialect.getDropForeignKeySql(change.getTableName(), detail.columnName());
    }

    @Override
    public String visitAddCheckConstraint(Change change, ChangeDetail.AddCheckConstraint detail) {
        return dialect.getAddCheckConstraintSql(change.getTableName(), detail.constraint());
    }

    @Override
    public String visitDropCheckConstraint(Change change, ChangeDetail.DropCheckConstraint detail) {
        return dialect.getDropCheckConstraintSql(change.getTableName(), detail.constraintName());
    }

    @Override
    public String visitAlterClustering(Change change, ChangeDetail.AlterClustering detail) {
        return dialect.getAlterClusteringSql(change.getTableName(), detail.toColumns());
    }

    @Override
    public String visitAlterPartitioning(Change change, ChangeDetail.AlterPartitioning detail) {
        String message = change.getErrorMessage() != null
                ? change.getErrorMessage()
                : "Cannot change partitioning for table '" + change.getTableName() + "'";
        throw new UnsupportedChangeException(ChangeType.ALTER_PARTITIONING, message);
    }

    @Override
    public String visitAlterTableProperties(Change change, ChangeDetail.AlterTableProperties detail) {
        return dialect.getSetTablePropertiesSql(change.getTableName(), detail.properties());
    }
}
