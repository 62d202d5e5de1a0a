package com.proposalmind.core.engine;

import com.proposalmind.core.error.ProposalmindException;
import com.proposalmind.core.events.EventBus;
import com.proposalmind.core.graph.ProposalGraph;
import com.proposalmind.core.logging.MdcContext;
import com.proposalmind.core.metrics.ProposalMetrics;
import com.proposalmind.core.model.FailureKind;
import com.proposalmind.core.model.PipelinePlan;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.session.ProposalSession;
import com.proposalmind.core.state.ProposalState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Runs a {@link PipelinePlan} through the compiled graph and reports the outcome.
 * <p>
 * Prerequisites are validated inside the graph before any level is dispatched;
 * levels then run strictly in order and the first failing level stops the run.
 * The progress listener hears {@code start}, {@code level} and {@code agent} from
 * the graph nodes and {@code complete} or {@code error} from here.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);

    private final ProposalGraph proposalGraph;
    private final RunRegistry runs;
    private final EventBus eventBus;
    private final ProposalMetrics metrics;

    public PipelineEngine(ProposalGraph proposalGraph, RunRegistry runs, EventBus eventBus, ProposalMetrics metrics) {
        this.proposalGraph = proposalGraph;
        this.runs = runs;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * @param plan     levels to run
     * @param input    initial state (idea, instruction, settings, previous sections)
     * @param check    prerequisites validated before dispatch
     * @param session  session the title is written through to; may be {@code null}
     * @param listener progress observer; may be {@code null}
     */
    public PipelineResult execute(PipelinePlan plan, Map<String, Object> input, PrerequisiteCheck check,
                                  ProposalSession session, ProgressListener listener) {
        String runId = UUID.randomUUID().toString();
        var run = new RunContext(runId, plan.kind(), session, listener, check, eventBus);

        var stateMap = new HashMap<String, Object>();
        input.forEach((key, value) -> {
            if (value != null) stateMap.put(key, value);
        });
        stateMap.put(ProposalState.RUN_ID, runId);
        stateMap.put(ProposalState.PIPELINE_KIND, plan.kind().name());
        stateMap.put(ProposalState.LEVELS, plan.levelIds());
        stateMap.put(ProposalState.LEVEL_INDEX, 0);
        stateMap.put(ProposalState.STAGE, PipelineStage.PENDING.name());

        runs.open(run);
        MdcContext.setRun(runId);
        try {
            log.info("Executing {} with levels {} ({} active runs)", plan.kind().displayName(),
                    plan.levelIds(), runs.activeCount());
            var config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            ProposalState finalState;
            try {
                finalState = proposalGraph.getCompiledGraph()
                        .invoke(stateMap, config)
                        .orElseThrow(() -> new ProposalmindException(
                                "Graph execution returned empty state for run " + runId));
            } catch (ProposalmindException e) {
                run.recordFailure(e);
                finalState = new ProposalState(stateMap);
            } catch (RuntimeException e) {
                log.error("Graph execution failed for run {}", runId, e);
                run.recordFailure(new ProposalmindException("Pipeline execution failed: " + e.getMessage(), e));
                finalState = new ProposalState(stateMap);
            }

            var result = toResult(finalState, run);
            if (result.succeeded()) {
                run.progress("complete", plan.kind().displayName() + " completed");
            } else {
                run.progress("error", result.failureMessage().orElse("Pipeline failed"));
            }
            if (metrics != null) {
                metrics.recordPipelineResult(plan.kind().name(), result.succeeded()
                        ? "completed" : result.failureKind().name().toLowerCase());
            }
            log.info("{} finished: stage={}, failure={}", plan.kind().displayName(),
                    result.stage(), result.failureKind());
            return result;
        } finally {
            runs.close(runId);
            MdcContext.clear();
        }
    }

    private PipelineResult toResult(ProposalState state, RunContext run) {
        var failure = run.failure().orElse(null);
        if (failure == null && state.stage() == PipelineStage.COMPLETED) {
            return new PipelineResult(state, PipelineStage.COMPLETED, FailureKind.NONE, null);
        }
        FailureKind kind = state.failureKind();
        if (kind == FailureKind.NONE) {
            kind = failure != null ? FailureKind.AGENT : FailureKind.INCOMPLETE;
        }
        return new PipelineResult(state, PipelineStage.FAILED, kind, failure);
    }
}
