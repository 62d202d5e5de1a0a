package com.proposalmind.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a pipeline run progresses.
 *
 * @param eventType event type (e.g. "pipeline.started", "level.started", "agent.completed")
 * @param runId     the pipeline run this event belongs to
 * @param agentId   the agent this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ProposalEvent(
    String eventType,
    String runId,
    String agentId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static ProposalEvent of(String eventType, String runId, String agentId, Map<String, Object> payload) {
        return new ProposalEvent(eventType, runId, agentId, payload, Instant.now());
    }
}
