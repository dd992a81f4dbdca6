package org.lakeshift.cli;

import org.lakeshift.client.JdbcSqlClient;
import org.lakeshift.client.SqlClient;
import org.lakeshift.config.MigrationSettings;

import java.util.Properties;

/**
 * Creates an unconnected client for validated settings.
 */
@FunctionalInterface
public interface SqlClientFactory {
    SqlClient create(MigrationSettings settings);

    static SqlClientFactory jdbc() {
        return settings -> {
            if (settings.getJdbcUrl() != null) {
                Properties props = new Properties();
                if (settings.getDatabricksToken() != null) {
                    props.setProperty("UID", "token");
                    props.setProperty("PWD", settings.getDatabricksToken());
                }
                return new JdbcSqlClient(settings.getJdbcUrl(), props);
            }
            return JdbcSqlClient.forDatabricks(settings.getDatabricksHost(), settings.getDatabricksHttpPath(),
                    settings.getDatabricksToken());
        };
    }
}
