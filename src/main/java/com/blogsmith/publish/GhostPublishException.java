package com.blogsmith.publish;

/**
 * Thrown when Ghost rejects a post or cannot be reached.
 */
public class GhostPublishException extends RuntimeException {

    public GhostPublishException(String message) {
        super(message);
    }

    public GhostPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
