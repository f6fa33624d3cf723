package com.blogsmith.core.stage;

/**
 * Thrown at a stage boundary once the run's {@link RunCancellation} has been triggered.
 */
public class RunCancelledException extends RuntimeException {

    private final String stage;

    public RunCancelledException(String stage, String reason) {
        super("Run cancelled before " + stage + ": " + reason);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
