package org.lakeshift.exception;

/**
 * Raised when a migration version is recorded again with a checksum that differs from
 * the one already stored for it.
 */
public class MigrationStateConflictException extends LakeshiftException {

    private final int version;

    public MigrationStateConflictException(int version, String recordedChecksum, String attemptedChecksum) {
        super("Migration " + version + " already recorded with checksum " + recordedChecksum
                + ", but attempted to record with checksum " + attemptedChecksum);
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
