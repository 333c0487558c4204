package com.gladlabs.orchestrator.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for execution events.
 * <p>
 * Supports per-execution subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations. A subscriber that throws
 * never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-execution subscribers keyed by executionId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<OrchestrationEvent>>> executionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<OrchestrationEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(OrchestrationEvent event) {
        log.debug("Publishing event: {} for execution {}", event.eventType(), event.executionId());

        if (event.executionId() != null) {
            List<Consumer<OrchestrationEvent>> subs = executionSubscribers.get(event.executionId());
            if (subs != null) {
                for (Consumer<OrchestrationEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<OrchestrationEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific execution.
     *
     * @param executionId the execution to subscribe to
     * @param consumer    callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String executionId, Consumer<OrchestrationEvent> consumer) {
        executionSubscribers.computeIfAbsent(executionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to execution {}", executionId);
        return () -> executionSubscribers.computeIfPresent(executionId, (id, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<OrchestrationEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<OrchestrationEvent> subscriber, OrchestrationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
