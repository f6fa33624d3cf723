package com.blogsmith.research;

/**
 * One web search hit.
 */
public record SearchResult(
    String title,
    String url,
    String description,
    String published
) {}
