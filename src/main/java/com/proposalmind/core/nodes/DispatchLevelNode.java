package com.proposalmind.core.nodes;

import com.proposalmind.agents.AgentRegistry;
import com.proposalmind.agents.ProposalAgent;
import com.proposalmind.core.engine.RunContext;
import com.proposalmind.core.engine.RunRegistry;
import com.proposalmind.core.error.AgentExecutionException;
import com.proposalmind.core.logging.MdcContext;
import com.proposalmind.core.metrics.ProposalMetrics;
import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.AgentStatus;
import com.proposalmind.core.model.FailureKind;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.state.ProposalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs every agent of the current level on the shared worker pool.
 * <p>
 * All agents of the level receive the same snapshot, taken once before
 * submission. Outputs are merged here, on the orchestrating thread, in completion
 * order; if two agents write the same key the later one wins. The title is the
 * exception: it is written through to the session by the worker that produced it,
 * without waiting for the rest of the level.
 * <p>
 * A failing agent does not cancel its siblings. Every submitted agent is awaited,
 * then the first failure marks the run failed so no further level is scheduled.
 */
@Component
public class DispatchLevelNode {

    private static final Logger log = LoggerFactory.getLogger(DispatchLevelNode.class);

    private final AgentRegistry agents;
    private final ExecutorService agentExecutor;
    private final RunRegistry runs;
    private final ProposalMetrics metrics;

    public DispatchLevelNode(AgentRegistry agents,
                             @Qualifier("agentExecutor") ExecutorService agentExecutor,
                             RunRegistry runs, ProposalMetrics metrics) {
        this.agents = agents;
        this.agentExecutor = agentExecutor;
        this.runs = runs;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ProposalState state) {
        var run = runs.require(state.runId());
        int levelNumber = state.levelIndex() + 1;
        var level = state.currentLevel().stream().map(AgentId::fromId).toList();
        Map<String, Object> snapshot = new HashMap<>(state.data());

        var completion = new ExecutorCompletionService<AgentOutcome>(agentExecutor);
        var submitted = new HashMap<Future<AgentOutcome>, AgentId>();
        for (var agentId : level) {
            var agent = agents.get(agentId);
            var future = completion.submit(() ->
                    runAgent(agent, new ProposalState(snapshot), run, levelNumber));
            submitted.put(future, agentId);
        }

        var merged = new LinkedHashMap<String, Object>();
        var statuses = new HashMap<String, String>();
        var completed = new ArrayList<String>();
        var errors = new ArrayList<String>();
        AgentExecutionException firstFailure = null;

        for (int i = 0; i < submitted.size(); i++) {
            AgentOutcome outcome;
            try {
                Future<AgentOutcome> done = completion.take();
                outcome = collect(done, submitted.get(done));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted while waiting for level {}", levelNumber);
                var pending = level.stream()
                        .filter(a -> !statuses.containsKey(a.id()))
                        .findFirst().orElse(level.get(0));
                if (firstFailure == null) {
                    firstFailure = new AgentExecutionException(pending, "interrupted while waiting for level " + levelNumber);
                }
                break;
            }

            var agentId = outcome.agentId();
            if (outcome.error() == null) {
                merged.putAll(outcome.output());
                statuses.put(agentId.id(), AgentStatus.DONE.name());
                completed.add(agentId.id());
                run.progress("agent", agentId.displayName() + " completed");
            } else {
                var failure = new AgentExecutionException(agentId, outcome.error());
                statuses.put(agentId.id(), AgentStatus.FAILED.name());
                errors.add(failure.getMessage());
                run.progress("agent", failure.getMessage());
                if (firstFailure == null) {
                    firstFailure = failure;
                }
            }
        }

        var updates = new HashMap<String, Object>(merged);
        updates.put(ProposalState.AGENT_STATUSES, statuses);
        updates.put(ProposalState.LEVEL_INDEX, state.levelIndex() + 1);
        if (!completed.isEmpty()) {
            updates.put(ProposalState.COMPLETED_AGENTS, completed);
        }
        if (!errors.isEmpty()) {
            updates.put(ProposalState.ERRORS, errors);
        }
        if (firstFailure != null) {
            run.recordFailure(firstFailure);
            log.error("Level {} failed: {}", levelNumber, firstFailure.getMessage());
            updates.put(ProposalState.STAGE, PipelineStage.FAILED.name());
            updates.put(ProposalState.FAILURE_KIND, FailureKind.AGENT.name());
            updates.put(ProposalState.FAILED_AGENT, firstFailure.getAgentId().id());
            updates.put(ProposalState.ERROR, firstFailure.getMessage());
        } else {
            log.info("Level {} done: {}", levelNumber, completed);
        }
        return updates;
    }

    private AgentOutcome collect(Future<AgentOutcome> done, AgentId agentId) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            // runAgent catches everything it can; this only sees Errors
            return AgentOutcome.failed(agentId, e.getCause() != null ? e.getCause() : e);
        }
    }

    private AgentOutcome runAgent(ProposalAgent agent, ProposalState snapshot, RunContext run, int levelNumber) {
        var agentId = agent.id();
        MdcContext.setAgent(run.runId(), agentId.id(), levelNumber);
        long startMs = System.currentTimeMillis();
        try {
            log.info("Running agent {}", agentId);
            run.publish("agent.started", agentId.id(), Map.of("status", AgentStatus.RUNNING.name()));

            var output = declaredOnly(agentId, agent.run(snapshot));
            if (agentId == AgentId.TITLE) {
                persistTitle(run, String.valueOf(output.getOrDefault(ProposalState.PROPOSAL_TITLE, "")));
            }

            long elapsedMs = System.currentTimeMillis() - startMs;
            recordExecution(agentId, elapsedMs, true);
            log.info("Agent {} finished in {}ms", agentId, elapsedMs);
            run.publish("agent.completed", agentId.id(),
                    Map.of("status", AgentStatus.DONE.name(), "elapsedMs", elapsedMs));
            return new AgentOutcome(agentId, output, null);
        } catch (Exception e) {
            long elapsedMs = System.currentTimeMillis() - startMs;
            recordExecution(agentId, elapsedMs, false);
            log.error("Agent {} failed after {}ms: {}", agentId, elapsedMs, e.getMessage(), e);
            run.publish("agent.failed", agentId.id(),
                    Map.of("status", AgentStatus.FAILED.name(), "error", String.valueOf(e.getMessage())));
            return AgentOutcome.failed(agentId, e);
        } finally {
            MdcContext.clear();
        }
    }

    private Map<String, Object> declaredOnly(AgentId agentId, Map<String, Object> output) {
        var declared = new LinkedHashMap<String, Object>();
        if (output == null) {
            return declared;
        }
        output.forEach((key, value) -> {
            if (!agentId.outputKeys().contains(key)) {
                log.warn("Agent {} wrote undeclared key '{}'; ignoring it", agentId, key);
            } else if (value != null) {
                declared.put(key, value);
            }
        });
        return declared;
    }

    private void persistTitle(RunContext run, String title) {
        if (title.isBlank()) {
            return;
        }
        run.session().ifPresent(session -> {
            session.setDocumentTitle(title);
            try {
                session.save();
                log.info("Title persisted: {}", title);
            } catch (Exception e) {
                log.warn("Could not persist title '{}': {}", title, e.getMessage());
            }
        });
    }

    private void recordExecution(AgentId agentId, long elapsedMs, boolean success) {
        if (metrics != null) {
            metrics.recordAgentExecution(agentId.id(), elapsedMs, success);
        }
    }

    private record AgentOutcome(AgentId agentId, Map<String, Object> output, Throwable error) {
        static AgentOutcome failed(AgentId agentId, Throwable error) {
            return new AgentOutcome(agentId, Map.of(), error);
        }
    }
}
