package com.blogsmith.config;

/**
 * Per-run overrides taken from the command line. {@code null} means "use the configured value".
 */
public record RunOptions(
    String tone,
    String instructions,
    Integer wordCount
) {

    public static RunOptions none() {
        return new RunOptions(null, null, null);
    }
}
