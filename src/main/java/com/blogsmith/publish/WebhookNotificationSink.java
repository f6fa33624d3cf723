package com.blogsmith.publish;

import com.blogsmith.config.BlogsmithProperties;
import com.blogsmith.core.collab.NotificationSink;
import com.blogsmith.core.model.PublicationNotice;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Announces published posts to an HTTP webhook. Does nothing unless
 * {@code blogsmith.webhook.enabled} is set and a URL is configured.
 */
@Component
public class WebhookNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationSink.class);

    static final int PREVIEW_LENGTH = 500;

    private final BlogsmithProperties.Webhook settings;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public WebhookNotificationSink(BlogsmithProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    WebhookNotificationSink(BlogsmithProperties properties, HttpClient httpClient) {
        this.settings = properties.getWebhook();
        this.httpClient = httpClient;
    }

    public boolean isEnabled() {
        return settings.isEnabled() && settings.getUrl() != null && !settings.getUrl().isBlank();
    }

    @Override
    public void notifyPublished(PublicationNotice notice) {
        if (!isEnabled()) {
            log.debug("Webhook disabled, skipping notification for post {}", notice.postId());
            return;
        }
        String body = payload(notice).toString();
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(settings.getUrl()))
                    .header("Content-Type", "application/json")
                    .timeout(settings.getTimeout())
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new WebhookException("Webhook returned HTTP %d: %s"
                        .formatted(response.statusCode(), response.body()));
            }
            log.info("Webhook notified for post {}", notice.postId());
        } catch (IOException e) {
            throw new WebhookException("Webhook request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WebhookException("Webhook request interrupted", e);
        }
    }

    ObjectNode payload(PublicationNotice notice) {
        String content = GhostPublishSink.withoutTitle(notice.content());
        ObjectNode node = objectMapper.createObjectNode();
        node.put("title", notice.title());
        node.put("url", notice.url());
        node.put("excerpt", notice.excerpt());
        var tags = node.putArray("tags");
        notice.tags().forEach(tags::add);
        node.put("content_preview", content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) : content);
        return node;
    }
}
