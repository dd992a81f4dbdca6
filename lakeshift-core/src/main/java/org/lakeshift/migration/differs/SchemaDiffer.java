package org.lakeshift.migration.differs;

import org.lakeshift.exception.DiffException;
import org.lakeshift.exception.LakeshiftException;
import org.lakeshift.model.Change;
import org.lakeshift.model.ChangeDetail;
import org.lakeshift.model.SchemaModel;
import org.lakeshift.model.TableModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Computes the changes that take {@code source} (the current database) to {@code target}
 * (the declared schema).
 * <p>
 * The differ only builds toward the declared state. Tables that exist only in the source
 * are left alone, so no {@code DROP_TABLE} is ever produced here.
 */
public class SchemaDiffer {
    private final List<TableComponentDiffer> differs;

    public SchemaDiffer() {
        this(createDefaultDiffers());
    }

    public SchemaDiffer(List<TableComponentDiffer> differs) {
        this.differs = List.copyOf(Objects.requireNonNull(differs, "differs must not be null"));
    }

    /**
     * 기본 differs - 파이프라인 순서 고정
     * 1. columns 2. constraints 3. clustering 4. partitioning 5. properties
     */
    private static List<TableComponentDiffer> createDefaultDiffers() {
        return List.of(
                new ColumnDiffer(),
                new ConstraintDiffer(),
                new ClusteringDiffer(),
                new PartitioningDiffer(),
                new TablePropertiesDiffer()
        );
    }

    public List<Change> diff(SchemaModel source, SchemaModel target) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");

        List<Change> changes = new ArrayList<>();
        for (String tableName : new TreeSet<>(target.tableNames())) {
            TableModel desired = target.getTable(tableName).orElseThrow();
            source.getTable(tableName).ifPresentOrElse(
                    current -> diffTable(current, desired, changes),
                    () -> changes.add(Change.of(tableName, new ChangeDetail.CreateTable(desired))));
        }
        return ChangeOrdering.sort(changes);
    }

    public List<Change> diffTable(TableModel source, TableModel target, List<Change> changes) {
        for (TableComponentDiffer differ : differs) {
            try {
                differ.diff(source, target, changes);
            } catch (LakeshiftException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new DiffException("Failed to diff table '" + target.getName() + "' with "
                        + differ.getClass().getSimpleName() + ": " + e.getMessage(), e);
            }
        }
        return changes;
    }
}
