package org.lakeshift.model;

import org.lakeshift.migration.spi.visitor.ChangeVisitor;

import java.util.List;
import java.util.Map;

/**
 * Kind-specific payload of a {@link Change}. Every variant carries only the fields its
 * kind needs and dispatches to exactly one method of {@link ChangeVisitor}.
 */
public interface ChangeDetail {

    ChangeType type();

    <R> R accept(ChangeVisitor<R> visitor, Change change);

    record CreateTable(TableModel table) implements ChangeDetail {
        public ChangeType type() { return ChangeType.CREATE_TABLE; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitCreateTable(c, this); }
    }

    record DropTable() implements ChangeDetail {
        public ChangeType type() { return ChangeType.DROP_TABLE; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitDropTable(c, this); }
    }

    record AddColumn(ColumnModel column) implements ChangeDetail {
        public ChangeType type() { return ChangeType.ADD_COLUMN; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitAddColumn(c, this); }
    }

    record DropColumn(String columnName) implements ChangeDetail {
        public ChangeType type() { return ChangeType.DROP_COLUMN; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitDropColumn(c, this); }
    }

    record AlterColumnType(String columnName, String fromType, String toType) implements ChangeDetail {
        public ChangeType type() { return ChangeType.ALTER_COLUMN_TYPE; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitAlterColumnType(c, this); }
    }

    record AlterColumnNullability(String columnName, boolean fromNullable, boolean toNullable) implements ChangeDetail {
        public ChangeType type() { return ChangeType.ALTER_COLUMN_NULLABILITY; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitAlterColumnNullability(c, this); }
    }

    record AlterColumnDefault(String columnName, String fromDefault, String toDefault) implements ChangeDetail {
        public ChangeType type() { return ChangeType.ALTER_COLUMN_DEFAULT; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitAlterColumnDefault(c, this); }
    }

    record SetPrimaryKey(PrimaryKeyModel primaryKey) implements ChangeDetail {
        public ChangeType type() { return ChangeType.SET_PRIMARY_KEY; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitSetPrimaryKey(c, this); }
    }

    record DropPrimaryKey(PrimaryKeyModel primaryKey) implements ChangeDetail {
        public ChangeType type() { return ChangeType.DROP_PRIMARY_KEY; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitDropPrimaryKey(c, this); }
    }

    record AddForeignKey(String columnName, ForeignKeyModel foreignKey) implements ChangeDetail {
        public ChangeType type() { return ChangeType.ADD_FOREIGN_KEY; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitAddForeignKey(c, this); }
    }

    record DropForeignKey(String columnName) implements ChangeDetail {
        public ChangeType type() { return ChangeType.DROP_FOREIGN_KEY; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitDropForeignKey(c, this); }
    }

    record AddCheckConstraint(CheckConstraintModel constraint) implements ChangeDetail {
        public ChangeType type() { return ChangeType.ADD_CHECK_CONSTRAINT; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitAddCheckConstraint(c, this); }
    }

    record DropCheckConstraint(String constraintName) implements ChangeDetail {
        public ChangeType type() { return ChangeType.DROP_CHECK_CONSTRAINT; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitDropCheckConstraint(c, this); }
    }

    record AlterClustering(List<String> fromColumns, List<String> toColumns) implements ChangeDetail {
        public ChangeType type() { return ChangeType.ALTER_CLUSTERING; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitAlterClustering(c, this); }
    }

    record AlterPartitioning(List<String> fromColumns, List<String> toColumns) implements ChangeDetail {
        public ChangeType type() { return ChangeType.ALTER_PARTITIONING; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitAlterPartitioning(c, this); }
    }

    record AlterTableProperties(Map<String, String> properties) implements ChangeDetail {
        public ChangeType type() { return ChangeType.ALTER_TABLE_PROPERTIES; }
        public <R> R accept(ChangeVisitor<R> v, Change c) { return v.visitAlterTableProperties(c, this); }
    }
}
