package org.lakeshift.migration.state;

import lombok.extern.slf4j.Slf4j;
import org.lakeshift.client.SqlClient;
import org.lakeshift.exception.MigrationStateConflictException;
import org.lakeshift.migration.dialect.databricks.DatabricksIdentifierPolicy;
import org.lakeshift.migration.dialect.databricks.DatabricksUtil;
import org.lakeshift.migration.spi.dialect.IdentifierPolicy;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Migration history kept in a Delta table {@code <catalog>.<schema>.<stateTable>}.
 * <p>
 * Identifiers are interpolated into SQL text, so each is validated up front. The table is
 * created on construction if it does not exist. Closing the store closes its client.
 */
@Slf4j
public class TableMigrationStateStore implements MigrationStateStore, AutoCloseable {
    public static final String DEFAULT_STATE_TABLE = "_lakeshift_migrations";

    private static final String COLUMNS = "version, name, checksum, applied_at, success, error";

    private final SqlClient client;
    private final String stateTableFqn;

    public TableMigrationStateStore(SqlClient client, String catalog, String schema, String stateTable) {
        this(client, catalog, schema, stateTable, new DatabricksIdentifierPolicy());
    }

    public TableMigrationStateStore(SqlClient client, String catalog, String schema, String stateTable,
                                    IdentifierPolicy identifierPolicy) {
        this.client = client;
        this.stateTableFqn = identifierPolicy.requireValid("catalog", catalog) + "."
                + identifierPolicy.requireValid("schema", schema) + "."
                + identifierPolicy.requireValid("state table", stateTable == null ? DEFAULT_STATE_TABLE : stateTable);
        ensureTable();
    }

    public String getStateTableFqn() {
        return stateTableFqn;
    }

    private void ensureTable() {
        client.execute("CREATE TABLE IF NOT EXISTS " + stateTableFqn + " ("
                + "version INT, name STRING, checksum STRING, applied_at TIMESTAMP, success BOOLEAN, error STRING"
                + ") USING DELTA");
        log.debug("Ensured migration state table {}", stateTableFqn);
    }

    @Override
    public List<AppliedMigration> listApplied() {
        return client.fetchAll("SELECT " + COLUMNS + " FROM " + stateTableFqn + " ORDER BY version").stream()
                .map(TableMigrationStateStore::toAppliedMigration)
                .sorted(Comparator.comparingInt(AppliedMigration::getVersion))
                .toList();
    }

    @Override
    public Optional<AppliedMigration> getLastApplied() {
        return client.fetchAll("SELECT " + COLUMNS + " FROM " + stateTableFqn + " ORDER BY version DESC LIMIT 1").stream()
                .map(TableMigrationStateStore::toAppliedMigration)
                .max(Comparator.comparingInt(AppliedMigration::getVersion));
    }

    @Override
    public boolean hasApplied(int version) {
        return !client.fetchAll("SELECT version FROM " + stateTableFqn + " WHERE version = " + version).isEmpty();
    }

    @Override
    public void recordApplied(int version, String name, String checksum, boolean success, String error) {
        Optional<AppliedMigration> existing = find(version);
        if (existing.isPresent()) {
            String recorded = existing.get().getChecksum();
            if (!recorded.equals(checksum)) {
                throw new MigrationStateConflictException(version, recorded, checksum);
            }
            log.debug("Migration {} already recorded, keeping first outcome", version);
            return;
        }
        client.execute("INSERT INTO " + stateTableFqn + " (" + COLUMNS + ") VALUES ("
                + version + ", "
                + literal(name) + ", "
                + literal(checksum) + ", "
                + "current_timestamp(), "
                + success + ", "
                + (error == null ? "NULL" : literal(error))
                + ")");
    }

    private Optional<AppliedMigration> find(int version) {
        return client.fetchAll("SELECT " + COLUMNS + " FROM " + stateTableFqn + " WHERE version = " + version).stream()
                .map(TableMigrationStateStore::toAppliedMigration)
                .filter(m -> m.getVersion() == version)
                .findFirst();
    }

    @Override
    public void close() {
        client.close();
    }

    private static String literal(String value) {
        return "'" + DatabricksUtil.escapeLiteral(value) + "'";
    }

    static AppliedMigration toAppliedMigration(Map<String, Object> row) {
        Object success = row.get("success");
        Object error = row.get("error");
        return AppliedMigration.builder()
                .version(((Number) row.get("version")).intValue())
                .name((String) row.get("name"))
                .checksum((String) row.get("checksum"))
                .appliedAt(toLocalDateTime(row.get("applied_at")))
                .success(success instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(success)))
                .error(error == null ? null : error.toString())
                .build();
    }

    private static LocalDateTime toLocalDateTime(Object value) {
        if (value == null) return null;
        if (value instanceof LocalDateTime ldt) return ldt;
        if (value instanceof Timestamp ts) return ts.toLocalDateTime();
        if (value instanceof OffsetDateTime odt) return odt.toLocalDateTime();
        return LocalDateTime.parse(value.toString().trim().replace(' ', 'T'));
    }
}
