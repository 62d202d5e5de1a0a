package com.proposalmind.core.events;

import com.proposalmind.core.metrics.ProposalMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

/**
 * Subscribes to the {@link EventBus} for the lifetime of the application and
 * turns every event into a debug trail entry and an event counter.
 */
@Component
public class ProposalEventRecorder implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ProposalEventRecorder.class);

    private final ProposalMetrics metrics;
    private final EventBus.Subscription subscription;

    public ProposalEventRecorder(EventBus eventBus, ProposalMetrics metrics) {
        this.metrics = metrics;
        this.subscription = eventBus.subscribeAll(this::record);
    }

    void record(ProposalEvent event) {
        if (event.agentId() != null) {
            log.debug("Run {} event {} for {}: {}", event.runId(), event.eventType(), event.agentId(), event.payload());
        } else {
            log.debug("Run {} event {}: {}", event.runId(), event.eventType(), event.payload());
        }
        metrics.recordEvent(event.eventType());
    }

    @Override
    public void destroy() {
        subscription.unsubscribe();
    }
}
