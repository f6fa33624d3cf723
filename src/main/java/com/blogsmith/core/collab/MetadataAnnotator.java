package com.blogsmith.core.collab;

import com.blogsmith.core.model.ArticleMetadata;

/**
 * Derives title, description, excerpt, tags and keywords for a piece of content.
 */
public interface MetadataAnnotator {

    ArticleMetadata annotate(String content, String instructions);
}
