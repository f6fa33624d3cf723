package com.blogsmith.core.collab;

import java.nio.file.Path;

/**
 * Local copy of every publish attempt, kept so a post can be re-sent later.
 */
public interface ContentArchive {

    /**
     * @return where the copy was written
     */
    Path save(PublishRequest request);
}
