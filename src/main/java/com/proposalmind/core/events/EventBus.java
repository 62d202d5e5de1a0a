package com.proposalmind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for pipeline progress.
 * <p>
 * Subscribers see the events of every run and filter on {@link ProposalEvent#runId()}
 * themselves. Delivery is synchronous on the publishing thread; a throwing
 * subscriber never affects the publisher.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<ProposalEvent>> subscribers =
            new CopyOnWriteArrayList<>();

    public void publish(ProposalEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());
        for (Consumer<ProposalEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<ProposalEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ProposalEvent> subscriber, ProposalEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
