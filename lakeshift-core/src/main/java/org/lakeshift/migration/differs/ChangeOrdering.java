package org.lakeshift.migration.differs;

import org.lakeshift.model.Change;
import org.lakeshift.model.ChangeType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Global dependency order of a change batch: creates first, drops last.
 * The sort is stable, so within one priority bucket the generation order is kept, except that
 * table creations are ordered by table name.
 */
public final class ChangeOrdering {

    public static final Comparator<Change> BY_PRIORITY = Comparator
            .comparingInt((Change c) -> c.getType().priority())
            .thenComparing((a, b) -> a.getType() == ChangeType.CREATE_TABLE && b.getType() == ChangeType.CREATE_TABLE
                    ? a.getTableName().compareTo(b.getTableName())
                    : 0);

    private ChangeOrdering() {
    }

    public static List<Change> sort(List<Change> changes) {
        List<Change> sorted = new ArrayList<>(changes);
        sorted.sort(BY_PRIORITY);
        return sorted;
    }
}
