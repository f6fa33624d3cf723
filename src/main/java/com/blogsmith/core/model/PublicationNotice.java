package com.blogsmith.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Payload handed to the notification sink after a successful publish.
 */
public record PublicationNotice(
    String postId,
    String url,
    String title,
    String excerpt,
    List<String> tags,
    String content
) implements Serializable {}
