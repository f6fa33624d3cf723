package com.blogsmith.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublish {

        @Test
        @DisplayName("global subscribers receive every run")
        void global() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(PipelineEvent.of("stage.completed", "BLOG-1", "draft", Map.of()));
            eventBus.publish(PipelineEvent.of("stage.completed", "BLOG-2", "draft", Map.of()));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("unsubscribed consumers stop receiving")
        void unsubscribe() {
            List<PipelineEvent> dropped = new ArrayList<>();
            List<PipelineEvent> kept = new ArrayList<>();
            var subscription = eventBus.subscribeAll(dropped::add);
            eventBus.subscribeAll(kept::add);
            subscription.unsubscribe();

            eventBus.publish(PipelineEvent.of("run.started", "BLOG-1", null, Map.of()));

            assertTrue(dropped.isEmpty());
            assertEquals(1, kept.size());
        }
    }

    @Nested
    @DisplayName("error isolation")
    class ErrorIsolation {

        @Test
        @DisplayName("a failing subscriber does not block the others")
        void failingSubscriber() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribeAll(e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(PipelineEvent.of("run.failed", "BLOG-1", null, Map.of())));
            assertEquals(1, received.size());
        }
    }
}
