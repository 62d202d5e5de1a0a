package com.proposalmind.core.engine;

import com.proposalmind.core.error.PrerequisiteException;
import com.proposalmind.core.error.UnknownAgentException;
import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.PipelineKind;
import com.proposalmind.core.model.RequestKind;
import com.proposalmind.core.scheduler.ClosureExpander;
import com.proposalmind.core.scheduler.DependencyGraph;
import com.proposalmind.core.scheduler.LevelPlanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineFactoryTest {

    private final PipelineFactory factory = new PipelineFactory(
            new ClosureExpander(DependencyGraph.standard()), new LevelPlanner(DependencyGraph.standard()));

    @Test
    @DisplayName("Full proposal is title, then content agents, then the compile step")
    void fullProposal() {
        var plan = factory.fullProposal();

        assertEquals(PipelineKind.FULL_PROPOSAL, plan.kind());
        assertEquals(List.of(
                List.of("title"),
                List.of("scope_refinement", "business_analyst", "technical_architect",
                        "project_manager", "resource_allocation"),
                List.of("final_compilation")), plan.levelIds());
    }

    @Test
    @DisplayName("Disabled agents are left out of the full plan")
    void fullProposalSubset() {
        var plan = factory.fullProposal(EnumSet.of(AgentId.SCOPE_REFINEMENT, AgentId.FINAL_COMPILATION));
        assertEquals(List.of(List.of("scope_refinement"), List.of("final_compilation")), plan.levelIds());
    }

    @Test
    @DisplayName("A scope edit pulls in everything downstream of it")
    void scopeEdit() {
        var plan = factory.edit(List.of("scope_refinement", "title"), RequestKind.EXPLICIT_EDIT, true);

        assertEquals(PipelineKind.EDIT, plan.kind());
        assertEquals(List.of(
                List.of("title", "scope_refinement"),
                List.of("business_analyst"),
                List.of("technical_architect"),
                List.of("project_manager"),
                List.of("resource_allocation")), plan.levelIds());
    }

    @Test
    @DisplayName("Identifiers are resolved leniently and duplicates collapse")
    void lenientIds() {
        var plan = factory.edit(List.of(" Project_Manager ", "project_manager"), RequestKind.EXPLICIT_EDIT, true);
        assertEquals(List.of(List.of("project_manager")), plan.levelIds());
    }

    @Test
    @DisplayName("An unknown id fails planning")
    void unknownId() {
        var ex = assertThrows(UnknownAgentException.class,
                () -> factory.edit(List.of("marketing"), RequestKind.EXPLICIT_EDIT, true));
        assertTrue(ex.getMessage().contains("marketing"));
    }

    @Test
    @DisplayName("An edit naming nothing fails planning")
    void emptyEdit() {
        assertThrows(PrerequisiteException.class,
                () -> factory.edit(List.of(), RequestKind.EXPLICIT_EDIT, true));
    }
}
