package com.ledgerwise.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for request processing events.
 * <p>
 * Supports per-request subscriptions and global subscriptions that receive
 * every event. A subscriber that throws does not affect other subscribers or
 * the publisher.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AssistantEvent>>> requestSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<AssistantEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(AssistantEvent event) {
        log.debug("Publishing event: {} for request {}", event.eventType(), event.requestId());
        List<Consumer<AssistantEvent>> subscribers = requestSubscribers.get(event.requestId());
        if (subscribers != null) {
            for (Consumer<AssistantEvent> subscriber : subscribers) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<AssistantEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to the events of one request.
     *
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(String requestId, Consumer<AssistantEvent> consumer) {
        requestSubscribers.computeIfAbsent(requestId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<AssistantEvent>> subs = requestSubscribers.get(requestId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    requestSubscribers.remove(requestId, subs);
                }
            }
        };
    }

    /** Subscribe to the events of every request. */
    public Subscription subscribeAll(Consumer<AssistantEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AssistantEvent> subscriber, AssistantEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
