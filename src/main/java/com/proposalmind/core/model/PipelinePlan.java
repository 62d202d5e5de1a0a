package com.proposalmind.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Ordered levels of agents for one pipeline run. Agents within a level may run
 * concurrently; levels run strictly in order.
 *
 * @param kind   which pipeline shape produced the plan
 * @param levels non-empty levels; no agent appears twice across the plan
 */
public record PipelinePlan(
    PipelineKind kind,
    List<List<AgentId>> levels
) implements Serializable {

    public PipelinePlan {
        var copy = new ArrayList<List<AgentId>>();
        var seen = EnumSet.noneOf(AgentId.class);
        for (var level : levels) {
            if (level.isEmpty()) {
                continue;
            }
            for (var agent : level) {
                if (!seen.add(agent)) {
                    throw new IllegalArgumentException("Agent " + agent + " appears in more than one level");
                }
            }
            copy.add(List.copyOf(level));
        }
        levels = List.copyOf(copy);
    }

    public List<AgentId> agents() {
        return levels.stream().flatMap(List::stream).toList();
    }

    public boolean isEmpty() {
        return levels.isEmpty();
    }

    /** Wire form stored in graph state: one list of agent ids per level. */
    public List<List<String>> levelIds() {
        return levels.stream()
                .map(level -> level.stream().map(AgentId::id).toList())
                .toList();
    }
}
