package com.proposalmind.core.settings;

import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.RoutingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Adds the planning and costing agents a turn's new constraints affect.
 * <p>
 * New rates pull in resource allocation. A new budget or timeline pulls in the
 * project manager, and a budget additionally pulls in resource allocation.
 * Any injection forces the action to edit, a routed full generation included.
 */
@Service
public class ConstraintPropagator {

    private static final Logger log = LoggerFactory.getLogger(ConstraintPropagator.class);

    public RoutingDecision propagate(RoutingDecision decision) {
        var settings = decision.extractedSettings();
        var result = decision;
        if (settings.hasRates()) {
            result = result.withInjectedTask(AgentId.RESOURCE_ALLOCATION.id());
        }
        if (settings.hasBudget() || settings.hasTimeline()) {
            result = result.withInjectedTask(AgentId.PROJECT_MANAGER.id());
        }
        if (settings.hasBudget()) {
            result = result.withInjectedTask(AgentId.RESOURCE_ALLOCATION.id());
        }
        if (result != decision) {
            log.info("Constraints changed (rates={}, budget={}, timeline={}); agents now {} with action {}",
                    settings.hasRates(), settings.hasBudget(), settings.hasTimeline(),
                    result.taskIds(), result.action());
        }
        return result;
    }
}
