package com.proposalmind.core.model;

import com.proposalmind.core.error.UnknownAgentException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Closed set of agents that contribute sections to a proposal.
 * <p>
 * Declaration order is the canonical execution order: expanded agent sets are
 * always returned sorted by ordinal so that retries are reproducible.
 */
public enum AgentId {

    TITLE("title", "Proposal Title",
            List.of("proposal_title"), List.of()),
    SCOPE_REFINEMENT("scope_refinement", "Scope Refinement",
            List.of("refined_scope", "similar_products"), List.of()),
    BUSINESS_ANALYST("business_analyst", "Business Analyst",
            List.of("business_analysis"), List.of("scope_refinement")),
    TECHNICAL_ARCHITECT("technical_architect", "Technical Architect",
            List.of("technical_spec"), List.of("scope_refinement", "business_analyst")),
    PROJECT_MANAGER("project_manager", "Project Manager",
            List.of("project_plan"),
            List.of("scope_refinement", "business_analyst", "technical_architect")),
    RESOURCE_ALLOCATION("resource_allocation", "Resource Allocation",
            List.of("resource_plan"),
            List.of("scope_refinement", "business_analyst", "technical_architect", "project_manager")),
    FINAL_COMPILATION("final_compilation", "Final Compilation",
            List.of("final_proposal", "stage", "error"),
            List.of("title", "scope_refinement", "business_analyst", "technical_architect",
                    "project_manager", "resource_allocation"));

    private final String id;
    private final String displayName;
    private final List<String> outputKeys;
    private final List<String> dependencyIds;

    AgentId(String id, String displayName, List<String> outputKeys, List<String> dependencyIds) {
        this.id = id;
        this.displayName = displayName;
        this.outputKeys = outputKeys;
        this.dependencyIds = dependencyIds;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    /** State keys this agent writes, in the order it produces them. The first key is its primary section. */
    public List<String> outputKeys() {
        return outputKeys;
    }

    public String primaryOutputKey() {
        return outputKeys.get(0);
    }

    public Set<AgentId> dependencies() {
        var deps = EnumSet.noneOf(AgentId.class);
        for (String dep : dependencyIds) {
            deps.add(fromId(dep));
        }
        return deps;
    }

    /** The sink runs last and only aggregates; it is never pulled in by dependency expansion. */
    public boolean isSink() {
        return this == FINAL_COMPILATION;
    }

    public static List<AgentId> contentAgents() {
        return Arrays.stream(values()).filter(a -> !a.isSink()).toList();
    }

    /**
     * Resolves a wire identifier such as {@code "business_analyst"}.
     * Matching is case-insensitive and tolerates surrounding whitespace.
     *
     * @throws UnknownAgentException if no agent carries the identifier
     */
    public static AgentId fromId(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnknownAgentException(String.valueOf(raw));
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AgentId agent : values()) {
            if (agent.id.equals(normalized)) {
                return agent;
            }
        }
        throw new UnknownAgentException(raw);
    }

    @Override
    public String toString() {
        return id;
    }
}
