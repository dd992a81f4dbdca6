package org.lakeshift.exception;

/**
 * Reading the live database state failed.
 */
public class IntrospectionException extends LakeshiftException {

    public IntrospectionException(String message) {
        super(message);
    }

    public IntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
