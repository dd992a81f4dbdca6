package org.lakeshift.migration.differs;

import org.lakeshift.model.Change;
import org.lakeshift.model.ChangeDetail;
import org.lakeshift.model.TableModel;

import java.util.HashSet;
import java.util.List;

/**
 * Delta cannot repartition existing data, so any change to the partition column set is
 * reported as unsupported. A reordering of the same columns is not a change.
 */
public class PartitioningDiffer implements TableComponentDiffer {

    @Override
    public void diff(TableModel source, TableModel target, List<Change> changes) {
        List<String> current = source.getPartitionedBy();
        List<String> desired = target.getPartitionedBy();
        if (new HashSet<>(current).equals(new HashSet<>(desired))) {
            return;
        }
        String table = target.getName();
        changes.add(Change.builder()
                .tableName(table)
                .detail(new ChangeDetail.AlterPartitioning(List.copyOf(current), List.copyOf(desired)))
                .unsupported(true)
                .errorMessage("Cannot change partitioning for table '" + table + "'. "
                        + "Current: " + current + ", Desired: " + desired + ". "
                        + "Delta Lake does not support changing partition columns. "
                        + "You must recreate the table.")
                .build());
    }
}
