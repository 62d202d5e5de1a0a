package com.proposalmind.agents;

import com.proposalmind.core.error.UnknownAgentException;
import com.proposalmind.core.model.AgentId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps every {@link AgentId} to its implementation.
 * <p>
 * Checked once at startup: each agent id must have exactly one implementation
 * and no state key may be declared by two agents.
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<AgentId, ProposalAgent> agents = new EnumMap<>(AgentId.class);

    public AgentRegistry(List<ProposalAgent> implementations) {
        for (var agent : implementations) {
            var previous = agents.put(agent.id(), agent);
            if (previous != null) {
                throw new IllegalStateException("Agent " + agent.id() + " has two implementations: "
                        + previous.getClass().getSimpleName() + " and " + agent.getClass().getSimpleName());
            }
        }
        for (var id : AgentId.values()) {
            if (!agents.containsKey(id)) {
                throw new IllegalStateException("No implementation registered for agent " + id);
            }
        }

        var owners = new HashMap<String, AgentId>();
        for (var agent : agents.values()) {
            for (String key : agent.outputKeys()) {
                var owner = owners.put(key, agent.id());
                if (owner != null) {
                    throw new IllegalStateException("State key '" + key + "' is written by both "
                            + owner + " and " + agent.id());
                }
            }
        }
        log.info("Registered {} agents: {}", agents.size(), agents.keySet());
    }

    /**
     * @throws UnknownAgentException if no implementation is registered
     */
    public ProposalAgent get(AgentId id) {
        var agent = agents.get(id);
        if (agent == null) {
            throw new UnknownAgentException(id.id());
        }
        return agent;
    }
}
