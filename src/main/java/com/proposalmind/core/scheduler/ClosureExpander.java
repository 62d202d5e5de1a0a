package com.proposalmind.core.scheduler;

import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.RequestKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;

/**
 * Decides which agents actually rerun for a request.
 * <p>
 * A single explicitly edited agent is never expanded, so a user can regenerate
 * exactly one section. Any other request is widened to its forward closure:
 * every agent that (transitively) depends on a requested one is added.
 * The sink is never pulled in by expansion; it only runs when asked for.
 */
@Service
public class ClosureExpander {

    private static final Logger log = LoggerFactory.getLogger(ClosureExpander.class);

    private final DependencyGraph graph;

    public ClosureExpander(DependencyGraph graph) {
        this.graph = graph;
    }

    /**
     * @param requested       agents named by the routing decision
     * @param kind            whether this is an explicit edit or a full generation
     * @param generatedBefore whether a full run has ever completed for the document
     * @return agents to run, in canonical declaration order, without duplicates
     */
    public List<AgentId> expand(Collection<AgentId> requested, RequestKind kind, boolean generatedBefore) {
        if (requested.isEmpty()) {
            return List.of();
        }
        var unique = EnumSet.copyOf(requested);
        if (kind == RequestKind.EXPLICIT_EDIT && unique.size() == 1) {
            log.info("Single explicit edit of {}; dependents are left untouched", unique);
            return List.copyOf(unique);
        }

        var included = EnumSet.copyOf(unique);
        var queue = new ArrayDeque<>(unique);
        while (!queue.isEmpty()) {
            var agent = queue.poll();
            for (var dependent : graph.dependentsOf(agent)) {
                if (!dependent.isSink() && included.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }

        if (!generatedBefore) {
            log.debug("Document not generated yet; expanding {} anyway", unique);
        }
        // EnumSet iterates in declaration order
        var expanded = List.copyOf(included);
        if (expanded.size() > unique.size()) {
            log.info("Expanded {} -> {}", unique, expanded);
        }
        return expanded;
    }
}
