package org.lakeshift.migration.runner;

/**
 * Runs the SQL of one migration, placeholders already substituted.
 */
@FunctionalInterface
public interface MigrationExecutor {
    void execute(String sql, int version) throws Exception;
}
