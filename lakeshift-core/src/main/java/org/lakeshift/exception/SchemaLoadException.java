package org.lakeshift.exception;

/**
 * Malformed or invalid declared schema.
 */
public class SchemaLoadException extends LakeshiftException {

    public SchemaLoadException(String message) {
        super(message);
    }

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
