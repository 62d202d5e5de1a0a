package com.proposalmind.core.nodes;

import com.proposalmind.core.engine.PrerequisiteCheck;
import com.proposalmind.core.engine.RunContext;
import com.proposalmind.core.engine.RunRegistry;
import com.proposalmind.core.error.PrerequisiteException;
import com.proposalmind.core.metrics.ProposalMetrics;
import com.proposalmind.core.model.AgentStatus;
import com.proposalmind.core.model.FailureKind;
import com.proposalmind.core.model.PipelineKind;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.state.ProposalState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validate, schedule and finish nodes.
 */
class PipelineNodesTest {

    private static final String RUN_ID = "run-nodes";
    private static final List<List<String>> LEVELS = List.of(
            List.of("title", "scope_refinement"),
            List.of("business_analyst", "technical_architect"),
            List.of("final_compilation"));

    private RunRegistry runs;
    private List<String> progress;

    private void open(PrerequisiteCheck check) {
        runs.open(new RunContext(RUN_ID, PipelineKind.FULL_PROPOSAL, null,
                (stage, message) -> progress.add(stage + ": " + message), check, null));
    }

    private ProposalState state(Map<String, Object> extra) {
        var data = new HashMap<String, Object>(extra);
        data.put(ProposalState.RUN_ID, RUN_ID);
        data.put(ProposalState.LEVELS, LEVELS);
        return new ProposalState(data);
    }

    @BeforeEach
    void setUp() {
        runs = new RunRegistry();
        progress = new ArrayList<>();
    }

    @Nested
    @DisplayName("ValidatePrerequisitesNode")
    class Validate {

        @Test
        @DisplayName("Missing idea fails the run before anything starts")
        void missingIdea() {
            open(PrerequisiteCheck.requireInitialIdea());

            var result = new ValidatePrerequisitesNode(runs).apply(state(Map.of()));

            assertEquals(PipelineStage.FAILED.name(), result.get(ProposalState.STAGE));
            assertEquals(FailureKind.PREREQUISITE.name(), result.get(ProposalState.FAILURE_KIND));
            assertInstanceOf(PrerequisiteException.class, runs.require(RUN_ID).failure().orElseThrow());
            assertTrue(progress.isEmpty());
        }

        @Test
        @DisplayName("A passing check marks every planned agent pending")
        @SuppressWarnings("unchecked")
        void passing() {
            open(PrerequisiteCheck.requireInitialIdea());

            var result = new ValidatePrerequisitesNode(runs)
                    .apply(state(Map.of(ProposalState.INITIAL_IDEA, "dog walking")));

            assertEquals(PipelineStage.RUNNING.name(), result.get(ProposalState.STAGE));
            var statuses = (Map<String, String>) result.get(ProposalState.AGENT_STATUSES);
            assertEquals(5, statuses.size());
            assertTrue(statuses.values().stream().allMatch(s -> s.equals(AgentStatus.PENDING.name())));
            assertEquals(List.of("start: Starting Full Proposal Pipeline: 5 agents in 3 levels"), progress);
        }
    }

    @Nested
    @DisplayName("ScheduleLevelNode")
    class Schedule {

        @Test
        @DisplayName("Picks the level at the current index")
        void picksLevel() {
            open(PrerequisiteCheck.none());
            var registry = new SimpleMeterRegistry();

            var result = new ScheduleLevelNode(runs, new ProposalMetrics(registry))
                    .apply(state(Map.of(ProposalState.LEVEL_INDEX, 1)));

            assertEquals(List.of("business_analyst", "technical_architect"), result.get(ProposalState.CURRENT_LEVEL));
            assertEquals(List.of("level: Level 2/3: business_analyst, technical_architect"), progress);
            assertEquals(1, registry.find("proposalmind.level.size").summary().count());
        }

        @Test
        @DisplayName("Past the last level the current level is empty")
        void exhausted() {
            open(PrerequisiteCheck.none());

            var result = new ScheduleLevelNode(runs, null).apply(state(Map.of(ProposalState.LEVEL_INDEX, 3)));

            assertEquals(List.of(), result.get(ProposalState.CURRENT_LEVEL));
            assertTrue(progress.isEmpty());
        }
    }

    @Nested
    @DisplayName("FinishPipelineNode")
    class Finish {

        private final FinishPipelineNode node = new FinishPipelineNode();

        @Test
        @DisplayName("A running pipeline completes")
        void completes() {
            var result = node.apply(state(Map.of(ProposalState.STAGE, PipelineStage.RUNNING.name())));
            assertEquals(PipelineStage.COMPLETED.name(), result.get(ProposalState.STAGE));
        }

        @Test
        @DisplayName("A failure without a recorded kind is incomplete content")
        void incomplete() {
            var result = node.apply(state(Map.of(
                    ProposalState.STAGE, PipelineStage.FAILED.name(),
                    ProposalState.ERROR, "Cannot compile proposal, missing: resource plan")));
            assertEquals(FailureKind.INCOMPLETE.name(), result.get(ProposalState.FAILURE_KIND));
        }

        @Test
        @DisplayName("An agent failure keeps its kind")
        void agentFailure() {
            var result = node.apply(state(Map.of(
                    ProposalState.STAGE, PipelineStage.FAILED.name(),
                    ProposalState.FAILURE_KIND, FailureKind.AGENT.name())));
            assertEquals(FailureKind.AGENT.name(), result.get(ProposalState.FAILURE_KIND));
        }
    }
}
