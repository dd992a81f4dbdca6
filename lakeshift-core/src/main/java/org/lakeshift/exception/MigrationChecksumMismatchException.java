package org.lakeshift.exception;

/**
 * The on-disk content of an already applied migration no longer matches the checksum
 * recorded when it was applied.
 */
public class MigrationChecksumMismatchException extends LakeshiftException {

    private final int version;
    private final String recordedChecksum;
    private final String fileChecksum;

    public MigrationChecksumMismatchException(int version, String name, String recordedChecksum, String fileChecksum) {
        super("Migration V" + version + "__" + name + " checksum mismatch: recorded="
                + recordedChecksum + ", file=" + fileChecksum);
        this.version = version;
        this.recordedChecksum = recordedChecksum;
        this.fileChecksum = fileChecksum;
    }

    public int getVersion() {
        return version;
    }

    public String getRecordedChecksum() {
        return recordedChecksum;
    }

    public String getFileChecksum() {
        return fileChecksum;
    }
}
