package org.lakeshift.exception;

/**
 * Base type for every failure raised by lakeshift. All subtypes are fatal to the
 * operation that raised them.
 */
public class LakeshiftException extends RuntimeException {

    public LakeshiftException(String message) {
        super(message);
    }

    public LakeshiftException(String message, Throwable cause) {
        super(message, cause);
    }
}
