package com.blogsmith.core.collab;

import com.blogsmith.core.model.PublishResult;

/**
 * Remote content system that receives the finished post.
 */
public interface PublishSink {

    PublishResult publish(PublishRequest request);
}
