package org.lakeshift.migration.output;

import org.lakeshift.migration.file.MigrationFile;
import org.lakeshift.migration.file.MigrationFileParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Writes a generated migration as the next version in a migrations directory.
 */
public class SqlMigrationWriter {
    private final MigrationFileParser parser;

    public SqlMigrationWriter() {
        this(new MigrationFileParser());
    }

    public SqlMigrationWriter(MigrationFileParser parser) {
        this.parser = parser;
    }

    /**
     * @return path of the written {@code V<next>__<slug>.sql}
     */
    public Path write(String sql, String description, Path migrationsDir) throws IOException {
        Files.createDirectories(migrationsDir);
        String filename = String.format("V%d__%s.sql", nextVersion(migrationsDir), slug(description));
        Path target = migrationsDir.resolve(filename);
        if (Files.exists(target)) {
            throw new IOException("Migration file already exists: " + target);
        }
        Files.writeString(target, sql, StandardCharsets.UTF_8);
        return target;
    }

    public int nextVersion(Path migrationsDir) {
        List<MigrationFile> existing = parser.parseDirectory(migrationsDir);
        return existing.isEmpty() ? 1 : existing.get(existing.size() - 1).version() + 1;
    }

    /** {@code "Add Orders table!"} becomes {@code add_orders_table}. */
    static String slug(String description) {
        String slug = description == null ? "" : description.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return slug.isEmpty() ? "migration" : slug;
    }
}
