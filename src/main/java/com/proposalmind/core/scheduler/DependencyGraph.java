package com.proposalmind.core.scheduler;

import com.proposalmind.core.model.AgentId;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph over agents. An edge A -> B means "B depends on A".
 * <p>
 * Besides the declared dependencies, the graph keeps the forward direction
 * (dependents) so that a rerun of A can be propagated to everything that
 * consumed A's output. The graph is validated to be acyclic on construction.
 */
public final class DependencyGraph {

    private final Map<AgentId, Set<AgentId>> dependencies = new EnumMap<>(AgentId.class);
    private final Map<AgentId, Set<AgentId>> dependents = new EnumMap<>(AgentId.class);

    /**
     * @param declared agent -> the agents it depends on; every referenced dependency
     *                 must itself be a key of the map
     * @throws IllegalArgumentException on a dangling dependency or a cycle
     */
    public DependencyGraph(Map<AgentId, ? extends Collection<AgentId>> declared) {
        for (var agent : declared.keySet()) {
            dependencies.put(agent, EnumSet.noneOf(AgentId.class));
            dependents.put(agent, EnumSet.noneOf(AgentId.class));
        }
        declared.forEach((agent, deps) -> {
            for (var dep : deps) {
                if (!dependencies.containsKey(dep)) {
                    throw new IllegalArgumentException(
                            "Agent " + agent + " depends on " + dep + " which is not part of the graph");
                }
                if (dep == agent) {
                    throw new IllegalArgumentException("Agent " + agent + " depends on itself");
                }
                dependencies.get(agent).add(dep);
                dependents.get(dep).add(agent);
            }
        });
        checkAcyclic();
    }

    /** Graph built from the dependencies declared on {@link AgentId}. */
    public static DependencyGraph standard() {
        var declared = new EnumMap<AgentId, Set<AgentId>>(AgentId.class);
        for (var agent : AgentId.values()) {
            declared.put(agent, agent.dependencies());
        }
        return new DependencyGraph(declared);
    }

    public boolean contains(AgentId agent) {
        return dependencies.containsKey(agent);
    }

    public Set<AgentId> agents() {
        return Collections.unmodifiableSet(dependencies.keySet());
    }

    public Set<AgentId> dependenciesOf(AgentId agent) {
        var deps = dependencies.get(agent);
        return deps == null ? Set.of() : Collections.unmodifiableSet(deps);
    }

    /** Agents that list {@code agent} as a dependency. */
    public Set<AgentId> dependentsOf(AgentId agent) {
        var deps = dependents.get(agent);
        return deps == null ? Set.of() : Collections.unmodifiableSet(deps);
    }

    private void checkAcyclic() {
        // Kahn's algorithm: every node must eventually reach in-degree zero
        var inDegree = new EnumMap<AgentId, Integer>(AgentId.class);
        dependencies.forEach((agent, deps) -> inDegree.put(agent, deps.size()));
        var ready = new ArrayDeque<AgentId>();
        inDegree.forEach((agent, degree) -> {
            if (degree == 0) ready.add(agent);
        });
        int visited = 0;
        while (!ready.isEmpty()) {
            var agent = ready.poll();
            visited++;
            for (var dependent : dependents.get(agent)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) ready.add(dependent);
            }
        }
        if (visited != dependencies.size()) {
            throw new IllegalArgumentException("Dependency graph contains a cycle");
        }
    }
}
