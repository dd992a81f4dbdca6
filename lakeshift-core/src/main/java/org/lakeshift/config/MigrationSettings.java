package org.lakeshift.config;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import org.lakeshift.exception.ConfigException;
import org.lakeshift.options.LakeshiftOptions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolved settings of one run: file profile, then environment, then CLI flags.
 */
@Value
@Builder(toBuilder = true)
public class MigrationSettings {
    String profile;
    String catalog;
    String schema;
    @Builder.Default Path schemaDir = Path.of(LakeshiftOptions.Paths.SCHEMA_DIR_DEFAULT);
    @Builder.Default Path migrationsDir = Path.of(LakeshiftOptions.Paths.MIGRATIONS_DIR_DEFAULT);
    @Builder.Default String stateTable = LakeshiftOptions.State.TABLE_DEFAULT;
    String databricksHost;
    String databricksHttpPath;
    @ToString.Exclude String databricksToken;
    String jdbcUrl;

    /**
     * Everything a command that talks to the warehouse needs: catalog, schema and either a
     * JDBC URL or host, HTTP path and token.
     *
     * @throws ConfigException naming every missing setting
     */
    public MigrationSettings validateForDatabase() {
        List<String> missing = new ArrayList<>();
        if (isBlank(catalog)) missing.add("catalog (" + LakeshiftOptions.Env.CATALOG + ")");
        if (isBlank(schema)) missing.add("schema (" + LakeshiftOptions.Env.SCHEMA + ")");
        if (isBlank(jdbcUrl)) {
            if (isBlank(databricksHost)) missing.add("databricks.host (" + LakeshiftOptions.Env.DATABRICKS_HOST + ")");
            if (isBlank(databricksHttpPath)) missing.add("databricks.httpPath (" + LakeshiftOptions.Env.DATABRICKS_HTTP_PATH + ")");
            if (isBlank(databricksToken)) missing.add("databricks.token (" + LakeshiftOptions.Env.DATABRICKS_TOKEN + ")");
        }
        if (!missing.isEmpty()) {
            throw new ConfigException("Missing required configuration: " + String.join(", ", missing));
        }
        return this;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
