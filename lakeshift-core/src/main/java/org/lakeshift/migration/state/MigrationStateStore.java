package org.lakeshift.migration.state;

import org.lakeshift.exception.MigrationStateConflictException;

import java.util.List;
import java.util.Optional;

/**
 * History of applied migrations.
 * <p>
 * Every implementation honours the same recording contract: recording a version again with
 * the same checksum is a no-op that keeps the first outcome, and recording it with a different
 * checksum fails without touching stored state.
 */
public interface MigrationStateStore {

    /** Ascending by version. */
    List<AppliedMigration> listApplied();

    Optional<AppliedMigration> getLastApplied();

    boolean hasApplied(int version);

    /**
     * @throws MigrationStateConflictException if {@code version} is already recorded with another checksum
     */
    void recordApplied(int version, String name, String checksum, boolean success, String error);

    default void recordApplied(int version, String name, String checksum, boolean success) {
        recordApplied(version, name, checksum, success, null);
    }
}
