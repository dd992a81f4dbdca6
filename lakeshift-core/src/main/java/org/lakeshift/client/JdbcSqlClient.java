package org.lakeshift.client;

import lombok.extern.slf4j.Slf4j;
import org.lakeshift.exception.SqlExecutionException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * {@link SqlClient} over a single JDBC connection. The Databricks JDBC driver is expected on
 * the runtime classpath.
 */
@Slf4j
public class JdbcSqlClient implements SqlClient {
    private final ConnectionFactory connectionFactory;
    private final String target;
    private Connection connection;

    @FunctionalInterface
    public interface ConnectionFactory {
        Connection open() throws SQLException;
    }

    public JdbcSqlClient(String jdbcUrl, Properties properties) {
        this(() -> DriverManager.getConnection(jdbcUrl, properties), redact(jdbcUrl));
    }

    public JdbcSqlClient(ConnectionFactory connectionFactory, String target) {
        this.connectionFactory = connectionFactory;
        this.target = target;
    }

    /**
     * Personal access token authentication against a SQL warehouse.
     */
    public static JdbcSqlClient forDatabricks(String host, String httpPath, String token) {
        String url = "jdbc:databricks://" + host + ":443/default;transportMode=http;ssl=1;AuthMech=3;httpPath=" + httpPath;
        Properties props = new Properties();
        props.setProperty("UID", "token");
        props.setProperty("PWD", token);
        return new JdbcSqlClient(url, props);
    }

    @Override
    public void connect() {
        if (connection != null) {
            throw new IllegalStateException("Already connected. Call close() before connecting again.");
        }
        try {
            connection = connectionFactory.open();
            log.debug("Connected to {}", target);
        } catch (SQLException e) {
            throw new SqlExecutionException("Failed to connect to " + target, e);
        }
    }

    @Override
    public boolean isConnected() {
        return connection != null;
    }

    @Override
    public void execute(String sql) {
        try (Statement stmt = requireConnection().createStatement()) {
            stmt.execute(sql);
        } catch (SQLException e) {
            throw new SqlExecutionException("Failed to execute statement: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Map<String, Object>> fetchAll(String sql) {
        try (Statement stmt = requireConnection().createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            ResultSetMetaData meta = rs.getMetaData();
            List<Map<String, Object>> rows = new ArrayList<>();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    row.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), rs.getObject(i));
                }
                rows.add(row);
            }
            return rows;
        } catch (SQLException e) {
            throw new SqlExecutionException("Failed to execute query: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            throw new SqlExecutionException("Failed to close connection", e);
        } finally {
            connection = null;
        }
    }

    private Connection requireConnection() {
        if (connection == null) {
            throw new IllegalStateException("Not connected. Call connect() first.");
        }
        return connection;
    }

    // 토큰이 URL에 들어있는 경우 로그에 남기지 않는다
    static String redact(String url) {
        return url.replaceAll("(?i)(PWD|token)=[^;]*", "$1=***");
    }
}
