package com.blogsmith.core.gate;

import java.util.List;

/**
 * Measurable signals extracted from a piece of Markdown content.
 *
 * @param wordCount        words after markup is stripped (link text kept)
 * @param inlineLinks      Markdown and HTML anchor links, images excluded
 * @param h1Count          top-level headings
 * @param h2Count          second-level headings
 * @param structuralIssues human-readable structural problems, in document order
 */
public record ContentMetrics(
    int wordCount,
    int inlineLinks,
    int h1Count,
    int h2Count,
    List<String> structuralIssues
) {

    public ContentMetrics {
        structuralIssues = structuralIssues == null ? List.of() : List.copyOf(structuralIssues);
    }
}
