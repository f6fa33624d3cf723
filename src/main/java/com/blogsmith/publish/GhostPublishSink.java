package com.blogsmith.publish;

import com.blogsmith.config.BlogsmithProperties;
import com.blogsmith.core.collab.PublishRequest;
import com.blogsmith.core.collab.PublishSink;
import com.blogsmith.core.model.ArticleMetadata;
import com.blogsmith.core.model.PublishResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
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
import java.util.regex.Pattern;

/**
 * Publishes posts through the Ghost Admin API.
 * <p>
 * The Markdown body is sent as a single mobiledoc markdown card. The leading H1 is removed
 * because Ghost renders the title separately.
 */
@Component
public class GhostPublishSink implements PublishSink {

    private static final Logger log = LoggerFactory.getLogger(GhostPublishSink.class);

    static final String POSTS_PATH = "/ghost/api/admin/posts/";
    static final int MAX_EXCERPT = 300;

    private static final Pattern TITLE_LINE = Pattern.compile("(?m)^#\\s+[^\\n]*\\n*");

    private final BlogsmithProperties.Ghost settings;
    private final GhostTokenFactory tokenFactory;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public GhostPublishSink(BlogsmithProperties properties, GhostTokenFactory tokenFactory) {
        this(properties, tokenFactory, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    GhostPublishSink(BlogsmithProperties properties, GhostTokenFactory tokenFactory, HttpClient httpClient) {
        this.settings = properties.getGhost();
        this.tokenFactory = tokenFactory;
        this.httpClient = httpClient;
    }

    @Override
    public PublishResult publish(PublishRequest request) {
        String endpoint = stripTrailingSlash(settings.getApiUrl()) + POSTS_PATH;
        String body = postBody(request).toString();
        log.info("Creating Ghost post '{}' ({}) at {}", request.metadata().title(),
                request.draft() ? "draft" : "published", endpoint);
        try {
            var httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint))
                    .header("Authorization", "Ghost " + tokenFactory.createToken())
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .timeout(Duration.ofSeconds(30))
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200 && response.statusCode() != 201) {
                throw new GhostPublishException("Ghost rejected the post (HTTP %d): %s"
                        .formatted(response.statusCode(), response.body()));
            }
            return parseResult(objectMapper.readTree(response.body()));
        } catch (IOException e) {
            throw new GhostPublishException("Ghost request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GhostPublishException("Ghost request interrupted", e);
        }
    }

    ObjectNode postBody(PublishRequest request) {
        ArticleMetadata metadata = request.metadata();
        ObjectNode post = objectMapper.createObjectNode();
        post.put("title", metadata.title().isBlank() ? "Untitled Post" : metadata.title());
        post.put("mobiledoc", mobiledoc(body(request)));
        post.put("meta_description", metadata.description());
        post.put("custom_excerpt", truncateExcerpt(metadata.excerpt()));
        post.put("status", request.draft() ? "draft" : "published");

        ArrayNode tags = post.putArray("tags");
        for (String tag : metadata.tags()) {
            tags.addObject().put("name", tag);
        }
        if (settings.getAuthorId() != null && !settings.getAuthorId().isBlank()) {
            post.putArray("authors").add(settings.getAuthorId());
        }

        ObjectNode root = objectMapper.createObjectNode();
        root.putArray("posts").add(post);
        return root;
    }

    /** Ghost's mobiledoc document holding one markdown card. */
    String mobiledoc(String markdown) {
        ObjectNode doc = objectMapper.createObjectNode();
        doc.put("version", "0.3.1");
        doc.putArray("atoms");
        ArrayNode card = doc.putArray("cards").addArray();
        card.add("markdown");
        card.addObject().put("markdown", markdown);
        doc.putArray("markups");
        doc.putArray("sections").addArray().add(10).add(0);
        return doc.toString();
    }

    PublishResult parseResult(JsonNode body) {
        JsonNode post = body.path("posts").path(0);
        if (post.isMissingNode() || post.path("id").asText("").isBlank()) {
            throw new GhostPublishException("Ghost response did not contain a post: " + body);
        }
        var result = new PublishResult(
                post.path("id").asText(),
                post.path("url").asText(""),
                post.path("status").asText("draft"));
        log.info("Ghost post created: id={}, status={}", result.postId(), result.status());
        return result;
    }

    /** Post body as Ghost should render it: disclosure note, if any, then the content without its H1. */
    static String body(PublishRequest request) {
        return withoutTitle(request.contentWithNote());
    }

    /** Removes the first H1 line; Ghost shows the post title separately. */
    static String withoutTitle(String content) {
        return TITLE_LINE.matcher(content).replaceFirst("").strip();
    }

    static String truncateExcerpt(String excerpt) {
        if (excerpt.length() <= MAX_EXCERPT) {
            return excerpt;
        }
        log.warn("Excerpt truncated from {} to {} chars", excerpt.length(), MAX_EXCERPT);
        return excerpt.substring(0, MAX_EXCERPT - 3) + "...";
    }

    private static String stripTrailingSlash(String url) {
        String value = url == null ? "" : url.strip();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
