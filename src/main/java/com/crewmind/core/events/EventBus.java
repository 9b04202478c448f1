package com.crewmind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for run lifecycle events.
 * <p>
 * Every subscriber receives every event in publish order. A subscriber that
 * throws is logged and skipped; it never affects the run.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<CrewmindEvent>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(CrewmindEvent event) {
        log.debug("Publishing {} for run {}", event.eventType(), event.runId());
        for (Consumer<CrewmindEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * @return handle used to unsubscribe
     */
    public Subscription subscribeAll(Consumer<CrewmindEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<CrewmindEvent> subscriber, CrewmindEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
