package com.proposalmind.core.nodes;

import com.proposalmind.core.model.FailureKind;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.state.ProposalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Settles the terminal stage. A run that failed without an agent or prerequisite
 * fault was stopped by the compile step for missing content.
 */
@Component
public class FinishPipelineNode {

    private static final Logger log = LoggerFactory.getLogger(FinishPipelineNode.class);

    public Map<String, Object> apply(ProposalState state) {
        if (state.stage() == PipelineStage.FAILED) {
            var kind = state.failureKind() == FailureKind.NONE ? FailureKind.INCOMPLETE : state.failureKind();
            log.info("Run {} failed ({}): {}", state.runId(), kind, state.error().orElse("no message"));
            return Map.of(ProposalState.FAILURE_KIND, kind.name());
        }
        log.info("Run {} completed; agents run: {}", state.runId(), state.completedAgents());
        return Map.of(ProposalState.STAGE, PipelineStage.COMPLETED.name());
    }
}
