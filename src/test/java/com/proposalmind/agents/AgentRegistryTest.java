package com.proposalmind.agents;

import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.state.ProposalState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentRegistryTest {

    @Test
    @DisplayName("Resolves every agent id")
    void resolves() {
        var registry = new AgentRegistry(StubAgent.standardSet());
        for (var id : AgentId.values()) {
            assertEquals(id, registry.get(id).id());
        }
    }

    @Test
    @DisplayName("A missing implementation is rejected")
    void missing() {
        var agents = new ArrayList<>(StubAgent.standardSet());
        agents.removeIf(a -> a.id() == AgentId.PROJECT_MANAGER);

        var ex = assertThrows(IllegalStateException.class, () -> new AgentRegistry(agents));
        assertTrue(ex.getMessage().contains("project_manager"));
    }

    @Test
    @DisplayName("Two implementations of one id are rejected")
    void duplicate() {
        var agents = new ArrayList<>(StubAgent.standardSet());
        agents.add(StubAgent.writing(AgentId.TITLE));

        assertThrows(IllegalStateException.class, () -> new AgentRegistry(agents));
    }

    @Test
    @DisplayName("A state key claimed by two agents is rejected")
    void sharedKey() {
        ProposalAgent greedy = new ProposalAgent() {
            @Override
            public AgentId id() {
                return AgentId.BUSINESS_ANALYST;
            }

            @Override
            public List<String> outputKeys() {
                return List.of(ProposalState.BUSINESS_ANALYSIS, ProposalState.TECHNICAL_SPEC);
            }

            @Override
            public Map<String, Object> run(ProposalState snapshot) {
                return Map.of();
            }
        };

        var ex = assertThrows(IllegalStateException.class,
                () -> new AgentRegistry(StubAgent.standardSet(greedy)));
        assertTrue(ex.getMessage().contains(ProposalState.TECHNICAL_SPEC));
    }
}
