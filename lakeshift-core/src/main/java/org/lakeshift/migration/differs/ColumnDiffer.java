package org.lakeshift.migration.differs;

import org.lakeshift.model.Change;
import org.lakeshift.model.ChangeDetail;
import org.lakeshift.model.ColumnModel;
import org.lakeshift.model.TableModel;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

public class ColumnDiffer implements TableComponentDiffer {
    private final TypeChangeValidator typeChangeValidator;

    public ColumnDiffer() {
        this(new TypeChangeValidator());
    }

    public ColumnDiffer(TypeChangeValidator typeChangeValidator) {
        this.typeChangeValidator = Objects.requireNonNull(typeChangeValidator, "typeChangeValidator must not be null");
    }

    @Override
    public void diff(TableModel source, TableModel target, List<Change> changes) {
        String table = target.getName();
        Map<String, ColumnModel> sourceColumns = source.columnsByName();
        Map<String, ColumnModel> targetColumns = target.columnsByName();

        // 이름 순으로 처리해야 ADD_COLUMN 순서가 결정적이다
        TreeSet<String> names = new TreeSet<>(targetColumns.keySet());
        names.addAll(sourceColumns.keySet());

        for (String name : names) {
            ColumnModel oldColumn = sourceColumns.get(name);
            ColumnModel newColumn = targetColumns.get(name);
            if (oldColumn == null) {
                changes.add(Change.of(table, new ChangeDetail.AddColumn(newColumn)));
            } else if (newColumn == null) {
                changes.add(Change.builder()
                        .tableName(table)
                        .detail(new ChangeDetail.DropColumn(name))
                        .destructive(true)
                        .requiresColumnMapping(true)
                        .build());
            } else {
                diffColumn(table, oldColumn, newColumn, changes);
            }
        }
    }

    private void diffColumn(String table, ColumnModel oldColumn, ColumnModel newColumn, List<Change> changes) {
        String name = newColumn.getName();

        if (!oldColumn.normalizedType().equals(newColumn.normalizedType())) {
            Optional<String> error = typeChangeValidator.validate(oldColumn.getType(), newColumn.getType());
            changes.add(Change.builder()
                    .tableName(table)
                    .detail(new ChangeDetail.AlterColumnType(name, oldColumn.getType(), newColumn.getType()))
                    .unsupported(error.isPresent())
                    .errorMessage(error.orElse(null))
                    .build());
        }

        if (oldColumn.isNullable() != newColumn.isNullable()) {
            changes.add(Change.of(table,
                    new ChangeDetail.AlterColumnNullability(name, oldColumn.isNullable(), newColumn.isNullable())));
        }

        if (!Objects.equals(oldColumn.getDefaultValue(), newColumn.getDefaultValue())) {
            changes.add(Change.of(table,
                    new ChangeDetail.AlterColumnDefault(name, oldColumn.getDefaultValue(), newColumn.getDefaultValue())));
        }
    }
}
