package org.lakeshift.cli;

import org.lakeshift.client.SqlClient;
import org.lakeshift.config.ConfigurationLoader;
import org.lakeshift.config.MigrationSettings;
import org.lakeshift.exception.ConfigException;
import org.lakeshift.migration.file.MigrationFile;
import org.lakeshift.migration.file.MigrationFileParser;
import org.lakeshift.migration.state.TableMigrationStateStore;
import org.lakeshift.model.SchemaModel;
import org.lakeshift.schema.InformationSchemaIntrospector;
import org.lakeshift.schema.SchemaLoader;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Shared options and error handling. Configuration errors exit with 2, every other failure with 1.
 */
abstract class AbstractLakeshiftCommand implements Callable<Integer> {

    @CommandLine.Option(names = "--profile", description = "설정 프로파일 (dev, prod 등)")
    String profile;
    @CommandLine.Option(names = "--catalog", description = "대상 catalog")
    String catalog;
    @CommandLine.Option(names = "--schema", description = "대상 schema")
    String schema;
    @CommandLine.Option(names = "--schema-dir", description = "스키마 YAML 디렉토리 또는 파일")
    Path schemaDir;
    @CommandLine.Option(names = "--migrations-dir", description = "마이그레이션 SQL 디렉토리")
    Path migrationsDir;
    @CommandLine.Option(names = "--state-table", description = "마이그레이션 이력 테이블 이름")
    String stateTable;

    protected final CliContext context;

    protected AbstractLakeshiftCommand() {
        this(CliContext.system());
    }

    protected AbstractLakeshiftCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return run(resolveSettings());
        } catch (ConfigException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return ExitCodes.CONFIG_ERROR;
        } catch (Exception e) {
            System.err.println(errorLabel() + ": " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }

    protected abstract int run(MigrationSettings settings) throws Exception;

    /** Prefix of the error line, e.g. {@code Diff error}. */
    protected abstract String errorLabel();

    MigrationSettings resolveSettings() {
        MigrationSettings loaded = new ConfigurationLoader(context.workingDirectory(), context.environment()).load(profile);
        MigrationSettings.MigrationSettingsBuilder builder = loaded.toBuilder();
        // CLI 플래그가 최우선
        if (catalog != null) builder.catalog(catalog);
        if (schema != null) builder.schema(schema);
        if (stateTable != null) builder.stateTable(stateTable);
        builder.schemaDir(context.resolve(schemaDir != null ? schemaDir : loaded.getSchemaDir()));
        builder.migrationsDir(context.resolve(migrationsDir != null ? migrationsDir : loaded.getMigrationsDir()));
        return builder.build();
    }

    SchemaModel loadDeclared(MigrationSettings settings) {
        return new SchemaLoader().load(settings.getSchemaDir());
    }

    /**
     * Opens a connection, introspects the configured schema and closes the connection again.
     */
    SchemaModel introspect(MigrationSettings settings) {
        settings.validateForDatabase();
        try (SqlClient client = context.clientFactory().create(settings)) {
            client.connect();
            return new InformationSchemaIntrospector(client, settings.getCatalog(), settings.getSchema()).introspect();
        }
    }

    List<MigrationFile> loadMigrations(MigrationSettings settings) {
        return new MigrationFileParser().parseDirectory(settings.getMigrationsDir());
    }

    /**
     * Runs {@code action} with a connected client and the state store on top of it. Both are
     * closed when the action returns or fails.
     */
    <T> T withStateStore(MigrationSettings settings, StateStoreAction<T> action) throws Exception {
        settings.validateForDatabase();
        try (SqlClient client = context.clientFactory().create(settings)) {
            client.connect();
            try (TableMigrationStateStore store = new TableMigrationStateStore(
                    client, settings.getCatalog(), settings.getSchema(), settings.getStateTable())) {
                return action.apply(client, store);
            }
        }
    }

    @FunctionalInterface
    interface StateStoreAction<T> {
        T apply(SqlClient client, TableMigrationStateStore store) throws Exception;
    }
}
