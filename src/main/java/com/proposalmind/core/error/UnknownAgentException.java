package com.proposalmind.core.error;

/**
 * Thrown when an agent identifier does not resolve to a registered agent.
 */
public class UnknownAgentException extends ProposalmindException {

    private final String agentId;

    public UnknownAgentException(String agentId) {
        super("Agent '" + agentId + "' not found in registry");
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
