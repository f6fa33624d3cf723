package com.blogsmith.dispatch.cli;

/**
 * Process exit codes of the {@code blogsmith} command.
 */
public final class ExitCodes {

    /** The post was published, with or without a disclosure note. */
    public static final int PUBLISHED = 0;
    /** The run failed or was cancelled. */
    public static final int FAILED = 1;
    /** Configuration was rejected before the run started. */
    public static final int CONFIGURATION = 2;

    private ExitCodes() {
    }
}
