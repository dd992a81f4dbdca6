package org.lakeshift.cli;

import org.lakeshift.config.MigrationSettings;
import org.lakeshift.migration.file.MigrationFile;
import org.lakeshift.migration.runner.MigrationPlanner;
import org.lakeshift.migration.runner.PendingMigration;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(
        name = "plan",
        description = "적용 대기 중인 마이그레이션 목록 출력"
)
public class PlanCommand extends AbstractLakeshiftCommand {

    public PlanCommand() {
        super();
    }

    PlanCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int run(MigrationSettings settings) throws Exception {
        List<MigrationFile> migrations = loadMigrations(settings);
        List<PendingMigration> pending = withStateStore(settings,
                (client, store) -> MigrationPlanner.plan(migrations, store));

        if (pending.isEmpty()) {
            System.out.println("No pending migrations");
            return ExitCodes.OK;
        }
        System.out.println("Pending migrations (" + pending.size() + "):");
        pending.forEach(pm -> System.out.println("  - " + pm.label()));
        return ExitCodes.OK;
    }

    @Override
    protected String errorLabel() {
        return "Plan error";
    }
}
