package com.blogsmith.research;

/**
 * Thrown when the web search API cannot be reached or answers with an error.
 */
public class SearchException extends RuntimeException {

    public SearchException(String message) {
        super(message);
    }

    public SearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
