package org.lakeshift.migration.differs;

import org.lakeshift.model.Change;
import org.lakeshift.model.TableModel;

import java.util.List;

/**
 * Compares one aspect of a table that exists on both sides and appends the resulting changes.
 */
@FunctionalInterface
public interface TableComponentDiffer {
    void diff(TableModel source, TableModel target, List<Change> changes);
}
