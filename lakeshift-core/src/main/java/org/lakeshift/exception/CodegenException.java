package org.lakeshift.exception;

import java.util.List;

/**
 * Migration SQL could not be generated for a change batch.
 * When the batch was rejected for unsupported changes, {@link #getErrors()} lists one
 * explanation per offending change.
 */
public class CodegenException extends LakeshiftException {

    private final List<String> errors;

    public CodegenException(String message) {
        super(message);
        this.errors = List.of();
    }

    public CodegenException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of();
    }

    public CodegenException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
