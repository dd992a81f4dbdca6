package org.lakeshift.exception;

/**
 * Malformed migration filename, empty migration content or duplicate version.
 */
public class MigrationParseException extends LakeshiftException {

    public MigrationParseException(String message) {
        super(message);
    }

    public MigrationParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
