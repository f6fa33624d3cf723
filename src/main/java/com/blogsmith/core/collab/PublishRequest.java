package com.blogsmith.core.collab;

import com.blogsmith.core.model.ArticleMetadata;

/**
 * Everything the publishing sink needs for one post.
 *
 * @param content    final Markdown content, without the disclosure note
 * @param metadata   post metadata
 * @param forcedNote disclosure note to prepend, empty unless the post was force-published
 * @param draft      whether to create the post unpublished
 */
public record PublishRequest(
    String content,
    ArticleMetadata metadata,
    String forcedNote,
    boolean draft
) {

    public PublishRequest {
        forcedNote = forcedNote == null ? "" : forcedNote;
    }

    public boolean hasForcedNote() {
        return !forcedNote.isBlank();
    }

    /** Content as it should appear on the remote system: disclosure note first, if any. */
    public String contentWithNote() {
        return hasForcedNote() ? forcedNote + content : content;
    }
}
