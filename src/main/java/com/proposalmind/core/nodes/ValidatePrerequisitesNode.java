package com.proposalmind.core.nodes;

import com.proposalmind.core.engine.RunRegistry;
import com.proposalmind.core.error.PrerequisiteException;
import com.proposalmind.core.model.AgentStatus;
import com.proposalmind.core.model.FailureKind;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.state.ProposalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Entry node: runs the prerequisite check before anything is dispatched.
 * A failed check ends the run with no agent having been started.
 */
@Component
public class ValidatePrerequisitesNode {

    private static final Logger log = LoggerFactory.getLogger(ValidatePrerequisitesNode.class);

    private final RunRegistry runs;

    public ValidatePrerequisitesNode(RunRegistry runs) {
        this.runs = runs;
    }

    public Map<String, Object> apply(ProposalState state) {
        var run = runs.require(state.runId());
        var problem = run.prerequisiteCheck().check(state);
        if (problem.isPresent()) {
            log.warn("Prerequisites not met for run {}: {}", run.runId(), problem.get());
            run.recordFailure(new PrerequisiteException(problem.get()));
            return Map.of(
                    ProposalState.STAGE, PipelineStage.FAILED.name(),
                    ProposalState.FAILURE_KIND, FailureKind.PREREQUISITE.name(),
                    ProposalState.ERROR, problem.get());
        }

        var statuses = new HashMap<String, String>();
        int agentCount = 0;
        for (var level : state.levels()) {
            for (var agentId : level) {
                statuses.put(agentId, AgentStatus.PENDING.name());
                agentCount++;
            }
        }
        run.progress("start", String.format("Starting %s: %d agents in %d levels",
                run.kind().displayName(), agentCount, state.levels().size()));
        return Map.of(
                ProposalState.STAGE, PipelineStage.RUNNING.name(),
                ProposalState.AGENT_STATUSES, statuses,
                ProposalState.LEVEL_INDEX, 0);
    }
}
