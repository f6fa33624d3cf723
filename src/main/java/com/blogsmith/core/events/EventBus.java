package com.blogsmith.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for pipeline run events.
 * <p>
 * Every subscriber receives the events of all runs, in publish order; filter on
 * {@link PipelineEvent#runId()} to follow a single run. A failing subscriber never affects
 * the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<PipelineEvent>> subscribers =
            new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());
        for (Consumer<PipelineEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events from all runs.
     */
    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PipelineEvent> subscriber, PipelineEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
