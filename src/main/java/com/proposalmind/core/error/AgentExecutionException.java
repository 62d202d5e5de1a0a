package com.proposalmind.core.error;

import com.proposalmind.core.model.AgentId;

/**
 * First failure raised by an agent body during a level. Aborts the remaining levels.
 */
public class AgentExecutionException extends ProposalmindException {

    private final AgentId agentId;

    public AgentExecutionException(AgentId agentId, Throwable cause) {
        super("Agent " + agentId.id() + " failed: " + describe(cause), cause);
        this.agentId = agentId;
    }

    public AgentExecutionException(AgentId agentId, String message) {
        super("Agent " + agentId.id() + " failed: " + message);
        this.agentId = agentId;
    }

    public AgentId getAgentId() {
        return agentId;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
