package com.blogsmith.publish;

import com.blogsmith.config.BlogsmithProperties;
import com.blogsmith.core.model.PublicationNotice;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class WebhookNotificationSinkTest {

    private static final PublicationNotice NOTICE = new PublicationNotice("p1", "https://blog.example.com/rust/",
            "Rust Ownership", "Excerpt", List.of("rust"), "# Rust Ownership\n\n" + "a".repeat(600));

    private BlogsmithProperties properties;
    private HttpClient httpClient;
    private WebhookNotificationSink sink;

    @BeforeEach
    void setUp() {
        properties = new BlogsmithProperties();
        properties.getWebhook().setEnabled(true);
        properties.getWebhook().setUrl("https://hooks.example.com/blog");
        httpClient = mock(HttpClient.class);
        sink = new WebhookNotificationSink(properties, httpClient);
    }

    @Test
    @DisplayName("disabled webhook sends nothing")
    void disabled() {
        properties.getWebhook().setEnabled(false);

        sink.notifyPublished(NOTICE);

        assertFalse(sink.isEnabled());
        verifyNoInteractions(httpClient);
    }

    @Test
    @DisplayName("enabled without a URL counts as disabled")
    void noUrl() {
        properties.getWebhook().setUrl(" ");

        sink.notifyPublished(NOTICE);

        verifyNoInteractions(httpClient);
    }

    @Test
    @DisplayName("posts the notice to the configured URL")
    void posts() throws Exception {
        respond(204);

        sink.notifyPublished(NOTICE);

        verify(httpClient).send(argThat(
                r -> r.uri().toString().equals("https://hooks.example.com/blog") && r.method().equals("POST")), any());
    }

    @Test
    @DisplayName("a non-2xx answer fails")
    void errorStatus() throws Exception {
        respond(500);

        assertThrows(WebhookException.class, () -> sink.notifyPublished(NOTICE));
    }

    @Test
    @DisplayName("interruption is wrapped and the flag restored")
    void interrupted() throws Exception {
        doThrow(new InterruptedException()).when(httpClient).send(any(), any());

        assertThrows(WebhookException.class, () -> sink.notifyPublished(NOTICE));
        assertTrue(Thread.interrupted());
    }

    @Test
    @DisplayName("payload carries a title-less content preview")
    void payload() {
        ObjectNode payload = sink.payload(NOTICE);

        assertEquals("Rust Ownership", payload.path("title").asText());
        assertEquals("rust", payload.path("tags").path(0).asText());
        String preview = payload.path("content_preview").asText();
        assertEquals(WebhookNotificationSink.PREVIEW_LENGTH, preview.length());
        assertFalse(preview.startsWith("#"));
    }

    @SuppressWarnings("unchecked")
    private void respond(int status) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn("");
        doReturn(response).when(httpClient).send(any(), any());
    }
}
