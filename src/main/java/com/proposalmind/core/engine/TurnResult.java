package com.proposalmind.core.engine;

import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.RoutingAction;
import com.proposalmind.core.model.RoutingDecision;

import java.util.List;
import java.util.Optional;

/**
 * What one user turn did.
 *
 * @param decision  the routing decision after constraint propagation
 * @param agentsRun agents the pipeline executed, in plan order; empty for conversation
 * @param pipeline  the pipeline outcome; {@code null} when no pipeline ran
 * @param reply     the message shown to the user
 * @param error     why the turn failed, {@code null} when it did not
 */
public record TurnResult(
    RoutingDecision decision,
    List<AgentId> agentsRun,
    PipelineResult pipeline,
    String reply,
    String error
) {

    public TurnResult {
        agentsRun = agentsRun != null ? List.copyOf(agentsRun) : List.of();
    }

    public RoutingAction action() {
        return decision.action();
    }

    public Optional<PipelineResult> pipelineResult() {
        return Optional.ofNullable(pipeline);
    }

    public boolean succeeded() {
        return error == null;
    }
}
