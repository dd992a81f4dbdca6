package org.lakeshift.exception;

import org.lakeshift.model.ChangeType;

/**
 * A single change that the engine cannot perform and that therefore cannot be rendered.
 */
public class UnsupportedChangeException extends LakeshiftException {

    private final ChangeType changeType;

    public UnsupportedChangeException(ChangeType changeType, String message) {
        super(message);
        this.changeType = changeType;
    }

    public ChangeType getChangeType() {
        return changeType;
    }
}
