package org.lakeshift.migration.runner;

import org.lakeshift.migration.file.MigrationFile;
import org.lakeshift.migration.state.MigrationStateStore;

import java.util.Comparator;
import java.util.List;

/**
 * Pending set computation. Reads the store, never writes to it.
 */
public final class MigrationPlanner {
    private MigrationPlanner() {
    }

    /**
     * @return migrations not yet recorded in {@code store}, ascending by version
     */
    public static List<PendingMigration> plan(List<MigrationFile> migrations, MigrationStateStore store) {
        return migrations.stream()
                .sorted(Comparator.comparingInt(MigrationFile::version))
                .filter(m -> !store.hasApplied(m.version()))
                .map(PendingMigration::of)
                .toList();
    }
}
