package org.lakeshift.cli;

import org.lakeshift.config.MigrationSettings;
import org.lakeshift.migration.file.MigrationFile;
import org.lakeshift.migration.runner.MigrationExecutor;
import org.lakeshift.migration.runner.MigrationRunner;
import org.lakeshift.migration.runner.SqlStatements;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(
        name = "run",
        description = "대기 중인 마이그레이션을 버전 순서대로 적용"
)
public class RunCommand extends AbstractLakeshiftCommand {

    @CommandLine.Option(names = "--dry-run", description = "Only list what would be applied")
    boolean dryRun;

    public RunCommand() {
        super();
    }

    RunCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int run(MigrationSettings settings) throws Exception {
        List<MigrationFile> migrations = loadMigrations(settings);
        if (migrations.isEmpty()) {
            System.out.println("No migration files found in " + settings.getMigrationsDir());
            return ExitCodes.OK;
        }

        List<Integer> executed = withStateStore(settings, (client, store) -> {
            MigrationExecutor executor = (sql, version) -> {
                for (String statement : SqlStatements.split(sql)) {
                    client.execute(statement);
                }
            };
            return new MigrationRunner(store, executor, settings.getCatalog(), settings.getSchema())
                    .apply(migrations, dryRun);
        });

        if (dryRun) {
            System.out.println("Dry run complete. No migrations were applied.");
        } else if (executed.isEmpty()) {
            System.out.println("Schema is up to date");
        } else {
            System.out.println("Applied " + executed.size() + " migrations: " + executed);
        }
        return ExitCodes.OK;
    }

    @Override
    protected String errorLabel() {
        return "Migration failed";
    }
}
