package com.blogsmith.core.collab;

/**
 * Writes article prose in Markdown.
 */
public interface DraftGenerator {

    String generate(DraftRequest request);
}
