package com.blogsmith.core.collab;

import com.blogsmith.core.model.PublicationNotice;

/**
 * Fire-and-forget relay told about each published post. Failures are logged by the caller
 * and never affect the run outcome.
 */
public interface NotificationSink {

    void notifyPublished(PublicationNotice notice);
}
