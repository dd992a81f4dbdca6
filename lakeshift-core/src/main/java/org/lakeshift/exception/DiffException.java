package org.lakeshift.exception;

/**
 * Reserved for failures inside the schema differ.
 */
public class DiffException extends LakeshiftException {

    public DiffException(String message) {
        super(message);
    }

    public DiffException(String message, Throwable cause) {
        super(message, cause);
    }
}
