package org.lakeshift.migration.runner;

import org.lakeshift.migration.file.MigrationFile;

import java.nio.file.Path;

public record PendingMigration(int version, String name, Path path, String checksum, String sql) {

    static PendingMigration of(MigrationFile file) {
        return new PendingMigration(file.version(), file.name(), file.path(), file.checksum(), file.sql());
    }

    public String label() {
        return "V" + version + "__" + name;
    }
}
