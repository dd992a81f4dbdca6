package org.lakeshift.migration.differs;

import org.lakeshift.model.Change;
import org.lakeshift.model.ChangeDetail;
import org.lakeshift.model.CheckConstraintModel;
import org.lakeshift.model.PrimaryKeyModel;
import org.lakeshift.model.TableModel;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Primary key is compared as a whole: any difference, including column order or the rely
 * flag, drops the old key and sets the new one. Check constraints are matched by name only.
 */
public class ConstraintDiffer implements TableComponentDiffer {

    @Override
    public void diff(TableModel source, TableModel target, List<Change> changes) {
        String table = target.getName();
        diffPrimaryKey(table, source.getPrimaryKey(), target.getPrimaryKey(), changes);
        diffChecks(table, source.checkConstraintsByName(), target.checkConstraintsByName(), changes);
    }

    private void diffPrimaryKey(String table, PrimaryKeyModel oldPk, PrimaryKeyModel newPk, List<Change> changes) {
        if (Objects.equals(oldPk, newPk)) {
            return;
        }
        if (oldPk != null) {
            changes.add(Change.of(table, new ChangeDetail.DropPrimaryKey(oldPk)));
        }
        if (newPk != null) {
            changes.add(Change.of(table, new ChangeDetail.SetPrimaryKey(newPk)));
        }
    }

    private void diffChecks(String table, Map<String, CheckConstraintModel> oldChecks,
                            Map<String, CheckConstraintModel> newChecks, List<Change> changes) {
        for (String name : new TreeSet<>(newChecks.keySet())) {
            if (!oldChecks.containsKey(name)) {
                changes.add(Change.of(table, new ChangeDetail.AddCheckConstraint(newChecks.get(name))));
            }
        }
        for (String name : new TreeSet<>(oldChecks.keySet())) {
            if (!newChecks.containsKey(name)) {
                changes.add(Change.of(table, new ChangeDetail.DropCheckConstraint(name)));
            }
        }
    }
}
