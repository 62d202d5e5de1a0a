package com.proposalmind.core.scheduler;

import com.proposalmind.core.model.AgentId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Partitions an agent set into ordered levels. Agents inside a level may run
 * concurrently; levels run strictly one after another.
 */
@Service
public class LevelPlanner {

    private static final Logger log = LoggerFactory.getLogger(LevelPlanner.class);

    private final DependencyGraph graph;

    public LevelPlanner(DependencyGraph graph) {
        this.graph = graph;
    }

    /**
     * Fixed layout used for full generation: {@code [title] -> [other content agents] -> [sink]}.
     * Agents missing from {@code selected} are filtered out and empty levels are dropped.
     */
    public List<List<AgentId>> staticLevels(Collection<AgentId> selected) {
        var wanted = selected.isEmpty() ? EnumSet.noneOf(AgentId.class) : EnumSet.copyOf(selected);

        var first = new ArrayList<AgentId>();
        var middle = new ArrayList<AgentId>();
        var last = new ArrayList<AgentId>();
        for (var agent : wanted) {
            if (agent == AgentId.TITLE) {
                first.add(agent);
            } else if (agent.isSink()) {
                last.add(agent);
            } else {
                middle.add(agent);
            }
        }

        var levels = new ArrayList<List<AgentId>>();
        for (var level : List.of(first, middle, last)) {
            if (!level.isEmpty()) {
                levels.add(List.copyOf(level));
            }
        }
        log.debug("Static levels for {}: {}", wanted, levels);
        return levels;
    }

    /**
     * Dependency-derived layout used for edits. An agent with no dependency inside
     * {@code selected} sits at level 0; any other agent sits one level above its
     * deepest in-subset dependency.
     */
    public List<List<AgentId>> computedLevels(Collection<AgentId> selected) {
        if (selected.isEmpty()) {
            return List.of();
        }
        var wanted = EnumSet.copyOf(selected);
        var depth = new EnumMap<AgentId, Integer>(AgentId.class);
        for (var agent : wanted) {
            levelOf(agent, wanted, depth);
        }

        var byLevel = new TreeMap<Integer, List<AgentId>>();
        // wanted iterates in declaration order, so each level is canonically ordered
        for (var agent : wanted) {
            byLevel.computeIfAbsent(depth.get(agent), k -> new ArrayList<>()).add(agent);
        }
        var levels = byLevel.values().stream().map(List::copyOf).toList();
        log.debug("Computed levels for {}: {}", wanted, levels);
        return levels;
    }

    /**
     * True when every agent's in-plan dependencies sit in a strictly earlier level
     * and no agent appears twice.
     */
    public boolean respectsDependencies(List<List<AgentId>> levels) {
        var placed = new EnumMap<AgentId, Integer>(AgentId.class);
        for (int i = 0; i < levels.size(); i++) {
            for (var agent : levels.get(i)) {
                if (placed.put(agent, i) != null) {
                    return false;
                }
            }
        }
        for (Map.Entry<AgentId, Integer> entry : placed.entrySet()) {
            for (var dep : graph.dependenciesOf(entry.getKey())) {
                Integer depLevel = placed.get(dep);
                if (depLevel != null && depLevel >= entry.getValue()) {
                    return false;
                }
            }
        }
        return true;
    }

    private int levelOf(AgentId agent, EnumSet<AgentId> wanted, Map<AgentId, Integer> memo) {
        Integer known = memo.get(agent);
        if (known != null) {
            return known;
        }
        int level = 0;
        for (var dep : graph.dependenciesOf(agent)) {
            if (wanted.contains(dep)) {
                level = Math.max(level, levelOf(dep, wanted, memo) + 1);
            }
        }
        memo.put(agent, level);
        return level;
    }
}
