package org.lakeshift.migration.file;

import org.lakeshift.exception.MigrationParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads versioned migration files named {@code V<version>__<name>.sql}.
 */
public class MigrationFileParser {
    public static final Pattern FILENAME_PATTERN = Pattern.compile("^V(\\d+)__(.+)\\.sql$");

    public MigrationFile parse(String content, String filename) {
        return parse(content, filename, Path.of(filename));
    }

    public MigrationFile parse(String content, String filename, Path path) {
        Matcher matcher = FILENAME_PATTERN.matcher(filename);
        if (!matcher.matches()) {
            throw new MigrationParseException("Invalid filename '" + filename
                    + "'. Expected format: V<version>__name.sql");
        }
        int version;
        try {
            version = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new MigrationParseException("Invalid filename '" + filename + "'. Version is out of range.", e);
        }
        if (content == null || content.trim().isEmpty()) {
            throw new MigrationParseException("Migration file '" + filename + "' is empty.");
        }
        return new MigrationFile(version, matcher.group(2), path, Checksums.sha256(content), content);
    }

    public MigrationFile parseFile(Path path) {
        String filename = path.getFileName().toString();
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MigrationParseException("Failed to read migration file '" + path + "': " + e.getMessage(), e);
        }
        return parse(content, filename, path);
    }

    /**
     * Parses every matching file of the directory, ascending by version. Files that do not
     * match the naming pattern are skipped; a missing or empty directory gives an empty list.
     *
     * @throws MigrationParseException if two files share a version
     */
    public List<MigrationFile> parseDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Path> candidates;
        try (Stream<Path> files = Files.list(directory)) {
            candidates = files
                    .filter(Files::isRegularFile)
                    .filter(p -> FILENAME_PATTERN.matcher(p.getFileName().toString()).matches())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new MigrationParseException("Failed to list migrations in '" + directory + "': " + e.getMessage(), e);
        }

        Map<Integer, String> versionsSeen = new HashMap<>();
        List<MigrationFile> migrations = new ArrayList<>();
        for (Path candidate : candidates) {
            MigrationFile migration = parseFile(candidate);
            String previous = versionsSeen.putIfAbsent(migration.version(), candidate.getFileName().toString());
            if (previous != null) {
                throw new MigrationParseException("Duplicate version " + migration.version() + ": '"
                        + previous + "' and '" + candidate.getFileName() + "'");
            }
            migrations.add(migration);
        }
        migrations.sort(Comparator.comparingInt(MigrationFile::version));
        return migrations;
    }
}
