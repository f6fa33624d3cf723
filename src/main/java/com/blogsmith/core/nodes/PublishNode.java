package com.blogsmith.core.nodes;

import com.blogsmith.core.collab.ContentArchive;
import com.blogsmith.core.collab.NotificationSink;
import com.blogsmith.core.collab.PublishRequest;
import com.blogsmith.core.collab.PublishSink;
import com.blogsmith.core.graph.PipelineTopology;
import com.blogsmith.core.metrics.PipelineMetrics;
import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.model.ArticleMetadata;
import com.blogsmith.core.model.PublicationNotice;
import com.blogsmith.core.model.PublishResult;
import com.blogsmith.core.stage.ExternalServiceException;
import com.blogsmith.core.stage.RunCancelledException;
import com.blogsmith.core.stage.RunContext;
import com.blogsmith.core.state.PipelineState;
import com.blogsmith.core.state.StateUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * LangGraph4j node that archives, publishes and announces the finished post.
 * <p>
 * Only reached after an approved or force-published gate decision. Archive and notification
 * failures become warnings; a publish failure fails the run. The archive is optional.
 */
@Component
public class PublishNode {

    private static final Logger log = LoggerFactory.getLogger(PublishNode.class);

    static final String ARCHIVE = "archive";
    static final String NOTIFY = "notify";

    private final PublishSink publishSink;
    private final NotificationSink notificationSink;
    private final ContentArchive archive;
    private final PipelineMetrics metrics;

    public PublishNode(PublishSink publishSink, NotificationSink notificationSink,
                       @Autowired(required = false) ContentArchive archive, PipelineMetrics metrics) {
        this.publishSink = publishSink;
        this.notificationSink = notificationSink;
        this.archive = archive;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(PipelineState state, RunContext run) {
        ArticleMetadata metadata = state.metadata().orElseThrow(() ->
                new IllegalStateException("Publish stage reached without metadata"));
        boolean forced = state.approvalStatus() == ApprovalStatus.FORCE_PUBLISHED;
        var request = new PublishRequest(
                state.finalContent(), metadata, forced ? state.forcedNote() : "", run.config().publishAsDraft());
        var update = StateUpdate.create();

        if (archive != null) {
            try {
                Path saved = run.stages().invoke(ARCHIVE, () -> archive.save(request));
                log.info("Archived post to {}", saved);
            } catch (ExternalServiceException e) {
                log.warn("Could not archive post locally: {}", e.getMessage());
                update.warning("Local archive failed: " + e.getMessage());
            }
        }

        log.info("Publishing '{}' as {}{}", metadata.title(), request.draft() ? "draft" : "published",
                forced ? " with disclosure note" : "");
        PublishResult result = run.stages().invoke(PipelineTopology.PUBLISH, () -> publishSink.publish(request));
        log.info("Published post {} at {}", result.postId(), result.url());
        update.publication(result);

        var notice = new PublicationNotice(result.postId(), result.url(), metadata.title(),
                metadata.excerpt(), metadata.tags(), request.contentWithNote());
        try {
            run.stages().invoke(NOTIFY, () -> {
                notificationSink.notifyPublished(notice);
                return Boolean.TRUE;
            });
        } catch (ExternalServiceException | RunCancelledException e) {
            // The post is already live; a lost notification never fails the run
            log.warn("Notification for post {} failed: {}", result.postId(), e.getMessage());
            metrics.incrementNotificationFailures();
            update.warning("Notification failed: " + e.getMessage());
        }
        return update.toMap();
    }
}
