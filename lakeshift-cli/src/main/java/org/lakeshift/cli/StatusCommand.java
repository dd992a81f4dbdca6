package org.lakeshift.cli;

import org.lakeshift.config.MigrationSettings;
import org.lakeshift.migration.file.MigrationFile;
import org.lakeshift.migration.state.AppliedMigration;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@CommandLine.Command(
        name = "status",
        description = "마이그레이션 적용 현황 출력"
)
public class StatusCommand extends AbstractLakeshiftCommand {

    public StatusCommand() {
        super();
    }

    StatusCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int run(MigrationSettings settings) throws Exception {
        List<MigrationFile> migrations = loadMigrations(settings);
        Map<Integer, AppliedMigration> applied = withStateStore(settings, (client, store) ->
                store.listApplied().stream()
                        .collect(Collectors.toMap(AppliedMigration::getVersion, Function.identity())));

        System.out.println("Migration status for " + settings.getCatalog() + "." + settings.getSchema() + ":");
        int appliedCount = 0;
        int failedCount = 0;
        for (MigrationFile migration : migrations) {
            AppliedMigration record = applied.get(migration.version());
            if (record == null) {
                System.out.println("  ○ " + migration.label() + " (pending)");
            } else if (record.isSuccess()) {
                appliedCount++;
                System.out.println("  ✓ " + migration.label() + " (applied " + record.getAppliedAt() + ")");
            } else {
                failedCount++;
                System.out.println("  ✗ " + migration.label() + " (failed: " + record.getError() + ")");
            }
        }
        int pendingCount = migrations.size() - appliedCount - failedCount;
        System.out.println("Total: " + migrations.size() + " migrations, " + appliedCount + " applied, "
                + failedCount + " failed, " + pendingCount + " pending");
        return ExitCodes.OK;
    }

    @Override
    protected String errorLabel() {
        return "Status error";
    }
}
