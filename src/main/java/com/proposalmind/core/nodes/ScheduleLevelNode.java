package com.proposalmind.core.nodes;

import com.proposalmind.core.engine.RunRegistry;
import com.proposalmind.core.logging.MdcContext;
import com.proposalmind.core.metrics.ProposalMetrics;
import com.proposalmind.core.state.ProposalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Selects the next level to dispatch. An empty {@code current_level} means every
 * level has run.
 */
@Component
public class ScheduleLevelNode {

    private static final Logger log = LoggerFactory.getLogger(ScheduleLevelNode.class);

    private final RunRegistry runs;
    private final ProposalMetrics metrics;

    public ScheduleLevelNode(RunRegistry runs, ProposalMetrics metrics) {
        this.runs = runs;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ProposalState state) {
        var levels = state.levels();
        int index = state.levelIndex();
        if (index >= levels.size()) {
            log.info("All {} levels dispatched", levels.size());
            return Map.of(ProposalState.CURRENT_LEVEL, List.of());
        }

        var level = levels.get(index);
        var run = runs.require(state.runId());
        MdcContext.setLevel(run.runId(), index + 1);
        log.info("Level {}/{}: {}", index + 1, levels.size(), level);
        run.progress("level", String.format("Level %d/%d: %s",
                index + 1, levels.size(), String.join(", ", level)));
        if (metrics != null) {
            metrics.recordLevelSize(level.size());
        }
        return Map.of(ProposalState.CURRENT_LEVEL, level);
    }
}
