package org.lakeshift.migration.runner;

import lombok.extern.slf4j.Slf4j;
import org.lakeshift.exception.MigrationChecksumMismatchException;
import org.lakeshift.migration.Placeholders;
import org.lakeshift.migration.file.MigrationFile;
import org.lakeshift.migration.state.AppliedMigration;
import org.lakeshift.migration.state.MigrationStateStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies pending migrations one at a time, in version order.
 * <p>
 * Checksums of every already applied migration are verified before anything runs. Each
 * pending migration is recorded exactly once, as success or failure, and the first failure
 * stops the run.
 */
@Slf4j
public class MigrationRunner {
    private final MigrationStateStore stateStore;
    private final MigrationExecutor executor;
    private final String catalog;
    private final String schema;

    public MigrationRunner(MigrationStateStore stateStore, MigrationExecutor executor, String catalog, String schema) {
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    public List<Integer> apply(List<MigrationFile> migrations) throws Exception {
        return apply(migrations, false);
    }

    /**
     * @return versions passed to the executor, empty for a dry run
     * @throws MigrationChecksumMismatchException if an applied migration's file changed since
     * @throws Exception whatever the executor raised, after the failure was recorded
     */
    public List<Integer> apply(List<MigrationFile> migrations, boolean dryRun) throws Exception {
        verifyChecksums(migrations);

        List<PendingMigration> pending = MigrationPlanner.plan(migrations, stateStore);
        if (pending.isEmpty()) {
            log.info("Schema is up to date. No pending migrations.");
            return List.of();
        }

        List<Integer> executed = new ArrayList<>();
        for (PendingMigration pm : pending) {
            if (dryRun) {
                log.info("[DRY RUN] Would apply {}", pm.label());
                continue;
            }

            log.info("Applying {}...", pm.label());
            String sql = Placeholders.substitute(pm.sql(), catalog, schema);
            try {
                executor.execute(sql, pm.version());
            } catch (Exception e) {
                String error = e.getMessage() != null ? e.getMessage() : e.toString();
                log.error("Failed {}: {}", pm.label(), e.getMessage());
                try {
                    stateStore.recordApplied(pm.version(), pm.name(), pm.checksum(), false, error);
                } catch (RuntimeException recordFailure) {
                    recordFailure.addSuppressed(e);
                    throw recordFailure;
                }
                throw e;
            }
            stateStore.recordApplied(pm.version(), pm.name(), pm.checksum(), true, null);
            executed.add(pm.version());
            log.info("Applied {}", pm.label());
        }
        return executed;
    }

    private void verifyChecksums(List<MigrationFile> migrations) {
        Map<Integer, AppliedMigration> applied = stateStore.listApplied().stream()
                .collect(Collectors.toMap(AppliedMigration::getVersion, Function.identity(), (a, b) -> a));
        for (MigrationFile mf : migrations) {
            AppliedMigration recorded = applied.get(mf.version());
            if (recorded != null && !recorded.getChecksum().equals(mf.checksum())) {
                throw new MigrationChecksumMismatchException(mf.version(), mf.name(), recorded.getChecksum(), mf.checksum());
            }
        }
    }
}
