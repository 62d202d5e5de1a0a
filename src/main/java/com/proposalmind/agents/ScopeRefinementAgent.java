package com.proposalmind.agents;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.proposalmind.core.llm.LlmParseException;
import com.proposalmind.core.llm.LlmResponses;
import com.proposalmind.core.llm.LlmService;
import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.state.ProposalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Sharpens the initial idea into a scope statement and lists comparable products.
 */
@Component
public class ScopeRefinementAgent extends AbstractSectionAgent {

    private static final Logger log = LoggerFactory.getLogger(ScopeRefinementAgent.class);

    private static final String SYSTEM_PROMPT = """
            You are a product consultant refining a client's software idea into a clear scope.
            Respond with a JSON object with two string fields:
            - "refined_scope": markdown covering objectives, core features, users and out-of-scope items
            - "similar_products": markdown list of existing comparable products and how this idea differs
            """;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScopeResponse(
        @JsonProperty("refined_scope") String refinedScope,
        @JsonProperty("similar_products") String similarProducts
    ) {}

    public ScopeRefinementAgent(LlmService llmService) {
        super(llmService);
    }

    @Override
    public AgentId id() {
        return AgentId.SCOPE_REFINEMENT;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    public Map<String, Object> run(ProposalState snapshot) {
        String response = llmService.call(SYSTEM_PROMPT, buildPrompt(snapshot), id().id());
        try {
            var parsed = LlmResponses.readJson(response, ScopeResponse.class);
            if (parsed.refinedScope() != null && !parsed.refinedScope().isBlank()) {
                return Map.of(
                        ProposalState.REFINED_SCOPE, parsed.refinedScope().trim(),
                        ProposalState.SIMILAR_PRODUCTS,
                        parsed.similarProducts() != null ? parsed.similarProducts().trim() : "");
            }
        } catch (LlmParseException e) {
            log.warn("Scope response was not JSON, keeping it as plain scope: {}", e.getMessage());
        }
        return Map.of(
                ProposalState.REFINED_SCOPE, LlmResponses.stripCodeFences(response),
                ProposalState.SIMILAR_PRODUCTS, snapshot.text(ProposalState.SIMILAR_PRODUCTS));
    }
}
