package org.lakeshift.migration.file;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One parsed {@code V<version>__<name>.sql} file.
 *
 * @param checksum SHA-256 hex of the LF-normalized content
 */
public record MigrationFile(int version, String name, Path path, String checksum, String sql) {
    public MigrationFile {
        if (version < 0) {
            throw new IllegalArgumentException("version must not be negative: " + version);
        }
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(checksum, "checksum must not be null");
        Objects.requireNonNull(sql, "sql must not be null");
    }

    /** {@code V3__add_orders} */
    public String label() {
        return "V" + version + "__" + name;
    }
}
