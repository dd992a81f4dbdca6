package org.lakeshift.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Map;

/**
 * Process state the commands depend on, passed in so tests can replace it.
 */
public record CliContext(Map<String, String> environment, Path workingDirectory, SqlClientFactory clientFactory, Clock clock) {

    public static CliContext system() {
        return new CliContext(System.getenv(), Paths.get("").toAbsolutePath(), SqlClientFactory.jdbc(), Clock.systemDefaultZone());
    }

    /** Relative paths are taken from {@link #workingDirectory()}. */
    public Path resolve(Path path) {
        return workingDirectory.resolve(path);
    }
}
