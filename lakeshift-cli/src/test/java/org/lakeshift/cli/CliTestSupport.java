package org.lakeshift.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

final class CliTestSupport {
    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T10:30:00Z"), ZoneOffset.UTC);

    static final String USERS_YAML = """
            table: users
            columns:
              - name: id
                type: BIGINT
                nullable: false
              - name: email
                type: STRING
            primary_key:
              columns: [id]
            """;

    private CliTestSupport() {
    }

    static Map<String, String> warehouseEnv() {
        Map<String, String> env = new HashMap<>();
        env.put("LAKESHIFT_CATALOG", "test_catalog");
        env.put("LAKESHIFT_SCHEMA", "test_schema");
        env.put("LAKESHIFT_JDBC_URL", "jdbc:databricks://localhost:443/default");
        return env;
    }

    static CliContext context(Path workingDirectory, Map<String, String> env, FakeSqlClient client) {
        return new CliContext(env, workingDirectory, settings -> client, CLOCK);
    }

    static void writeUsersSchema(Path workingDirectory) throws IOException {
        Path schemaDir = Files.createDirectories(workingDirectory.resolve("schema"));
        Files.writeString(schemaDir.resolve("users.yaml"), USERS_YAML);
    }

    static Path migrationsDir(Path workingDirectory) throws IOException {
        return Files.createDirectories(workingDirectory.resolve("sql/migrations"));
    }
}
