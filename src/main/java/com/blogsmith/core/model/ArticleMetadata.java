package com.blogsmith.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * SEO and listing metadata attached to a post.
 */
public record ArticleMetadata(
    String title,
    String description,
    String excerpt,
    List<String> tags,
    List<String> keywords
) implements Serializable {

    public ArticleMetadata {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        excerpt = excerpt == null ? "" : excerpt;
        tags = tags == null ? List.of() : List.copyOf(tags);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
