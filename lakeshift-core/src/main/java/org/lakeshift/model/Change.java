package org.lakeshift.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.lakeshift.migration.spi.visitor.ChangeVisitor;

import java.util.Objects;

/**
 * One classified difference between the current and the declared schema.
 * <p>
 * The three flags are independent: a change may be destructive and still supported
 * (DROP_COLUMN), or unsupported without being destructive (ALTER_PARTITIONING).
 * An unsupported change always carries an error message.
 */
@Getter
@ToString
public class Change {
    private final String tableName;
    private final ChangeDetail detail;
    private final boolean destructive;
    private final boolean unsupported;
    private final boolean requiresColumnMapping;
    private final String errorMessage;

    @Builder
    private Change(String tableName, ChangeDetail detail, boolean destructive, boolean unsupported,
                   boolean requiresColumnMapping, String errorMessage) {
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
        if (unsupported && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("Unsupported change on '" + tableName + "' requires an error message");
        }
        this.destructive = destructive;
        this.unsupported = unsupported;
        this.requiresColumnMapping = requiresColumnMapping;
        this.errorMessage = errorMessage;
    }

    public static Change of(String tableName, ChangeDetail detail) {
        return Change.builder().tableName(tableName).detail(detail).build();
    }

    public ChangeType getType() {
        return detail.type();
    }

    public <R> R accept(ChangeVisitor<R> visitor) {
        return detail.accept(visitor, this);
    }

    /** {@code create_table: users} */
    public String label() {
        return getType().wireName() + ": " + tableName;
    }

    /**
     * Like {@link #label()}, with the column appended for column-level kinds, e.g.
     * {@code alter_column_type: orders.qty}.
     */
    public String qualifiedLabel() {
        String column = columnName();
        return column == null ? label() : label() + "." + column;
    }

    private String columnName() {
        if (detail instanceof ChangeDetail.AddColumn d) return d.column().getName();
        if (detail instanceof ChangeDetail.DropColumn d) return d.columnName();
        if (detail instanceof ChangeDetail.AlterColumnType d) return d.columnName();
        if (detail instanceof ChangeDetail.AlterColumnNullability d) return d.columnName();
        if (detail instanceof ChangeDetail.AlterColumnDefault d) return d.columnName();
        if (detail instanceof ChangeDetail.AddForeignKey d) return d.columnName();
        if (detail instanceof ChangeDetail.DropForeignKey d) return d.columnName();
        return null;
    }
}
