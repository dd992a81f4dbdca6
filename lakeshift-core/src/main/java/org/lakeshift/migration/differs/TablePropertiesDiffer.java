package org.lakeshift.migration.differs;

import org.lakeshift.model.Change;
import org.lakeshift.model.ChangeDetail;
import org.lakeshift.model.TableModel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merge-only: properties that the declared table does not mention are left untouched.
 */
public class TablePropertiesDiffer implements TableComponentDiffer {

    @Override
    public void diff(TableModel source, TableModel target, List<Change> changes) {
        Map<String, String> current = source.getTableProperties();
        Map<String, String> changed = new LinkedHashMap<>();
        target.getTableProperties().forEach((key, value) -> {
            if (!Objects.equals(current.get(key), value)) {
                changed.put(key, value);
            }
        });
        if (!changed.isEmpty()) {
            changes.add(Change.of(target.getName(), new ChangeDetail.AlterTableProperties(changed)));
        }
    }
}
