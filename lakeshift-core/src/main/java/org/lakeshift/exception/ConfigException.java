package org.lakeshift.exception;

/**
 * Missing or invalid connection, catalog or schema configuration.
 */
public class ConfigException extends LakeshiftException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
