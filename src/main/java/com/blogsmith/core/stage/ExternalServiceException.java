package com.blogsmith.core.stage;

/**
 * A collaborator call failed, timed out or returned nothing. Recorded in the run's
 * {@code errors} and ends the run as failed; the pipeline never retries it.
 */
public class ExternalServiceException extends RuntimeException {

    private final String stage;

    public ExternalServiceException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public ExternalServiceException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
