package com.blogsmith.core.model;

import java.io.Serializable;

/**
 * What the publishing sink reports back for a created post.
 *
 * @param postId remote identifier of the post
 * @param url    public (or preview) URL
 * @param status remote status, e.g. "draft" or "published"
 */
public record PublishResult(
    String postId,
    String url,
    String status
) implements Serializable {}
