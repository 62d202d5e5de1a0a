package com.proposalmind.core.routing;

import com.proposalmind.core.error.RoutingParseException;
import com.proposalmind.core.llm.LlmParseException;
import com.proposalmind.core.llm.LlmResponses;
import com.proposalmind.core.model.RoutingAction;
import com.proposalmind.core.model.RoutingDecision;

/**
 * Reads a {@link RoutingDecision} out of raw classifier output. Markdown fences
 * and prose around the JSON object are tolerated.
 */
public final class RoutingDecisionParser {

    private RoutingDecisionParser() {}

    /**
     * @throws RoutingParseException if the output holds no usable decision
     */
    public static RoutingDecision parse(String response) {
        if (response == null || response.isBlank()) {
            throw new RoutingParseException("Classifier returned no content");
        }
        RoutingDecision decision;
        try {
            decision = LlmResponses.readJson(response, RoutingDecision.class);
        } catch (LlmParseException e) {
            throw new RoutingParseException("Malformed routing decision: " + e.getMessage(), e);
        }
        if (decision == null) {
            throw new RoutingParseException("Malformed routing decision: empty object");
        }
        var settings = decision.extractedSettings();
        boolean constraintsGiven = settings.hasRates() || settings.hasBudget() || settings.hasTimeline();
        if (decision.action() == RoutingAction.EDIT && decision.taskIds().isEmpty() && !constraintsGiven) {
            throw new RoutingParseException("Edit decision names no sections");
        }
        return decision;
    }
}
