package org.lakeshift.cli;

public final class ExitCodes {
    public static final int OK = 0;
    public static final int ERROR = 1;
    public static final int CONFIG_ERROR = 2;

    private ExitCodes() {
    }
}
