package org.lakeshift.model;

import java.util.Locale;

/**
 * Kinds of schema change the differ can produce and the generator can render.
 * <p>
 * {@link #priority()} is the ordering bucket used when a batch is sorted: creates first,
 * drops last. A kind without a bucket sorts after everything else.
 */
public enum ChangeType {
    CREATE_TABLE(0),
    DROP_TABLE(7),
    ADD_COLUMN(1),
    DROP_COLUMN(6),
    ALTER_COLUMN_TYPE(2),
    ALTER_COLUMN_NULLABILITY(2),
    ALTER_COLUMN_DEFAULT(2),
    SET_PRIMARY_KEY(3),
    DROP_PRIMARY_KEY(5),
    ADD_FOREIGN_KEY(3),
    DROP_FOREIGN_KEY(5),
    ADD_CHECK_CONSTRAINT(3),
    DROP_CHECK_CONSTRAINT(5),
    ALTER_CLUSTERING(4),
    ALTER_PARTITIONING(ChangeType.UNORDERED),
    ALTER_TABLE_PROPERTIES(4);

    static final int UNORDERED = 99;

    private final int priority;

    ChangeType(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }

    /**
     * Lower-case form written into generated migration files, e.g. {@code create_table}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
