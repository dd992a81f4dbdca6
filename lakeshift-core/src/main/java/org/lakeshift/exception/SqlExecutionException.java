package org.lakeshift.exception;

/**
 * A statement sent through the SQL client failed.
 */
public class SqlExecutionException extends LakeshiftException {

    public SqlExecutionException(String message) {
        super(message);
    }

    public SqlExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
