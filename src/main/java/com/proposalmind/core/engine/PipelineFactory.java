package com.proposalmind.core.engine;

import com.proposalmind.core.error.PrerequisiteException;
import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.PipelineKind;
import com.proposalmind.core.model.PipelinePlan;
import com.proposalmind.core.model.RequestKind;
import com.proposalmind.core.scheduler.ClosureExpander;
import com.proposalmind.core.scheduler.LevelPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Turns a routed request into a {@link PipelinePlan}. Every agent id is resolved
 * here, so an unknown id fails before any agent runs.
 */
@Service
public class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    private final ClosureExpander expander;
    private final LevelPlanner planner;

    public PipelineFactory(ClosureExpander expander, LevelPlanner planner) {
        this.expander = expander;
        this.planner = planner;
    }

    public PipelinePlan fullProposal() {
        return fullProposal(Arrays.asList(AgentId.values()));
    }

    /**
     * Static three-level plan restricted to {@code enabledAgents}.
     */
    public PipelinePlan fullProposal(Collection<AgentId> enabledAgents) {
        var plan = new PipelinePlan(PipelineKind.FULL_PROPOSAL, planner.staticLevels(enabledAgents));
        log.info("Planned {}: {}", plan.kind().displayName(), plan.levelIds());
        return plan;
    }

    /**
     * Plan for an edit of the named agents, widened by dependency expansion unless
     * exactly one agent was explicitly asked for.
     *
     * @throws com.proposalmind.core.error.UnknownAgentException if an id is not registered
     * @throws PrerequisiteException if no agent is named
     */
    public PipelinePlan edit(List<String> rawIds, RequestKind kind, boolean generatedBefore) {
        var requested = new ArrayList<AgentId>();
        for (String raw : rawIds) {
            requested.add(AgentId.fromId(raw));
        }
        if (requested.isEmpty()) {
            throw new PrerequisiteException("No sections were selected for the edit");
        }

        var expanded = expander.expand(requested, kind, generatedBefore);
        var levels = planner.computedLevels(expanded);
        if (!planner.respectsDependencies(levels)) {
            throw new IllegalStateException("Computed levels violate dependency order: " + levels);
        }
        var plan = new PipelinePlan(PipelineKind.EDIT, levels);
        log.info("Planned {} for {}: {}", plan.kind().displayName(), rawIds, plan.levelIds());
        return plan;
    }
}
