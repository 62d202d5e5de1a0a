package com.proposalmind.core.graph;

import com.proposalmind.config.ProposalmindProperties;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.nodes.DispatchLevelNode;
import com.proposalmind.core.nodes.FinishPipelineNode;
import com.proposalmind.core.nodes.ScheduleLevelNode;
import com.proposalmind.core.nodes.ValidatePrerequisitesNode;
import com.proposalmind.core.state.ProposalState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that runs a
 * planned pipeline level by level.
 * <pre>
 *   START -> validate_prerequisites -> [routeAfterValidate]
 *         -> END  (prerequisites not met)
 *         -> schedule_level -> [routeAfterSchedule]
 *            -> dispatch_level -> [routeAfterDispatch]
 *               -> schedule_level (next level)
 *               -> finish -> END  (level failed)
 *            -> finish -> END  (no levels left)
 * </pre>
 */
@Component
public class ProposalGraph {

    private static final Logger log = LoggerFactory.getLogger(ProposalGraph.class);

    private final CompiledGraph<ProposalState> compiledGraph;

    public ProposalGraph(
            ValidatePrerequisitesNode validateNode,
            ScheduleLevelNode scheduleNode,
            DispatchLevelNode dispatchNode,
            FinishPipelineNode finishNode,
            ProposalmindProperties properties) throws Exception {

        var graph = new StateGraph<>(ProposalState.SCHEMA, ProposalState::new)
                .addNode("validate_prerequisites", node_async(validateNode::apply))
                .addNode("schedule_level", node_async(scheduleNode::apply))
                .addNode("dispatch_level", node_async(dispatchNode::apply))
                .addNode("finish", node_async(finishNode::apply))
                .addEdge(START, "validate_prerequisites")
                .addConditionalEdges("validate_prerequisites",
                        edge_async(this::routeAfterValidate),
                        Map.of("schedule_level", "schedule_level",
                                END, END))
                .addConditionalEdges("schedule_level",
                        edge_async(this::routeAfterSchedule),
                        Map.of("dispatch_level", "dispatch_level",
                                "finish", "finish"))
                .addConditionalEdges("dispatch_level",
                        edge_async(this::routeAfterDispatch),
                        Map.of("schedule_level", "schedule_level",
                                "finish", "finish"))
                .addEdge("finish", END);

        this.compiledGraph = graph.compile(CompileConfig.builder()
                .recursionLimit(properties.getRecursionLimit())
                .build());
        log.info("Pipeline graph compiled (recursion limit {})", properties.getRecursionLimit());
    }

    String routeAfterValidate(ProposalState state) {
        return state.stage() == PipelineStage.FAILED ? END : "schedule_level";
    }

    /** An empty level means every planned level has run. */
    String routeAfterSchedule(ProposalState state) {
        return state.currentLevel().isEmpty() ? "finish" : "dispatch_level";
    }

    String routeAfterDispatch(ProposalState state) {
        return state.stage() == PipelineStage.FAILED ? "finish" : "schedule_level";
    }

    public CompiledGraph<ProposalState> getCompiledGraph() {
        return compiledGraph;
    }
}
