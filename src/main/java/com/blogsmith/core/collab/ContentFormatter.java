package com.blogsmith.core.collab;

/**
 * Normalizes a draft into publishable Markdown.
 */
public interface ContentFormatter {

    String format(String draft);
}
