package com.blogsmith.publish;

import com.blogsmith.config.BlogsmithProperties;
import com.blogsmith.core.collab.PublishRequest;
import com.blogsmith.core.model.ArticleMetadata;
import com.blogsmith.core.model.PublishResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GhostPublishSinkTest {

    private static final String CONTENT = "# Rust Ownership\n\nIntro paragraph.\n\n## Borrowing\n\nDetails.";
    private static final ArticleMetadata METADATA = new ArticleMetadata("Rust Ownership", "About ownership",
            "Short excerpt", List.of("rust", "memory"), List.of());

    private final ObjectMapper mapper = new ObjectMapper();
    private BlogsmithProperties properties;
    private GhostTokenFactory tokenFactory;
    private HttpClient httpClient;
    private GhostPublishSink sink;

    @BeforeEach
    void setUp() {
        properties = new BlogsmithProperties();
        properties.getGhost().setApiUrl("https://blog.example.com/");
        tokenFactory = mock(GhostTokenFactory.class);
        when(tokenFactory.createToken()).thenReturn("signed.jwt.token");
        httpClient = mock(HttpClient.class);
        sink = new GhostPublishSink(properties, tokenFactory, httpClient);
    }

    @Nested
    @DisplayName("publish")
    class Publish {

        @Test
        @DisplayName("posts to the admin endpoint and reads the created post")
        void created() throws Exception {
            respond(201, "{\"posts\":[{\"id\":\"p1\",\"url\":\"https://blog.example.com/rust/\",\"status\":\"draft\"}]}");

            PublishResult result = sink.publish(new PublishRequest(CONTENT, METADATA, "", true));

            var captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(captor.capture(), any());
            HttpRequest sent = captor.getValue();
            assertEquals("https://blog.example.com/ghost/api/admin/posts/", sent.uri().toString());
            assertEquals("Ghost signed.jwt.token", sent.headers().firstValue("Authorization").orElseThrow());
            assertEquals("POST", sent.method());
            assertEquals(new PublishResult("p1", "https://blog.example.com/rust/", "draft"), result);
        }

        @Test
        @DisplayName("a non-success status fails with the response body")
        void rejected() throws Exception {
            respond(422, "{\"errors\":[{\"message\":\"Validation error\"}]}");

            var ex = assertThrows(GhostPublishException.class,
                    () -> sink.publish(new PublishRequest(CONTENT, METADATA, "", true)));

            assertTrue(ex.getMessage().contains("422"));
            assertTrue(ex.getMessage().contains("Validation error"));
        }

        @Test
        @DisplayName("a response without a post fails")
        void emptyResponse() throws Exception {
            respond(200, "{\"posts\":[]}");

            assertThrows(GhostPublishException.class,
                    () -> sink.publish(new PublishRequest(CONTENT, METADATA, "", true)));
        }

        @Test
        @DisplayName("transport errors are wrapped")
        void ioFailure() throws Exception {
            doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

            var ex = assertThrows(GhostPublishException.class,
                    () -> sink.publish(new PublishRequest(CONTENT, METADATA, "", true)));

            assertInstanceOf(IOException.class, ex.getCause());
        }
    }

    @Nested
    @DisplayName("post body")
    class PostBody {

        @Test
        @DisplayName("carries metadata, status and tags")
        void fields() {
            JsonNode post = sink.postBody(new PublishRequest(CONTENT, METADATA, "", false)).path("posts").path(0);

            assertEquals("Rust Ownership", post.path("title").asText());
            assertEquals("About ownership", post.path("meta_description").asText());
            assertEquals("Short excerpt", post.path("custom_excerpt").asText());
            assertEquals("published", post.path("status").asText());
            assertEquals("memory", post.path("tags").path(1).path("name").asText());
            assertTrue(post.path("authors").isMissingNode());
        }

        @Test
        @DisplayName("the markdown card holds the content without its title")
        void markdownCard() throws Exception {
            JsonNode post = sink.postBody(new PublishRequest(CONTENT, METADATA, "", true)).path("posts").path(0);

            JsonNode mobiledoc = mapper.readTree(post.path("mobiledoc").asText());
            assertEquals("0.3.1", mobiledoc.path("version").asText());
            assertEquals("markdown", mobiledoc.path("cards").path(0).path(0).asText());
            assertEquals("Intro paragraph.\n\n## Borrowing\n\nDetails.",
                    mobiledoc.path("cards").path(0).path(1).path("markdown").asText());
        }

        @Test
        @DisplayName("a disclosure note stays ahead of the body")
        void forcedNote() {
            var request = new PublishRequest(CONTENT, METADATA, "> Note: did not pass review.\n\n", true);

            assertEquals("> Note: did not pass review.\n\nIntro paragraph.\n\n## Borrowing\n\nDetails.",
                    GhostPublishSink.body(request));
        }

        @Test
        @DisplayName("author and fallback title are applied")
        void authorAndTitle() {
            properties.getGhost().setAuthorId("author-1");
            var untitled = new ArticleMetadata("", "", "", List.of(), List.of());

            JsonNode post = sink.postBody(new PublishRequest(CONTENT, untitled, "", true)).path("posts").path(0);

            assertEquals("Untitled Post", post.path("title").asText());
            assertEquals("author-1", post.path("authors").path(0).asText());
        }

        @Test
        @DisplayName("long excerpts are cut with an ellipsis")
        void excerpt() {
            String cut = GhostPublishSink.truncateExcerpt("x".repeat(400));

            assertEquals(GhostPublishSink.MAX_EXCERPT, cut.length());
            assertTrue(cut.endsWith("..."));
        }
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(response).when(httpClient).send(any(), any());
    }
}
