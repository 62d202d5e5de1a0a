package com.proposalmind.agents;

import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.state.ProposalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sink of the full pipeline: assembles the proposal document from the sections.
 * <p>
 * Missing content is a business outcome rather than a fault, so this agent never
 * throws for it. It reports {@code stage=FAILED} with a message naming the
 * missing sections instead.
 */
@Component
public class FinalCompilationAgent implements ProposalAgent {

    private static final Logger log = LoggerFactory.getLogger(FinalCompilationAgent.class);

    /** Required section keys with the names used in user-facing messages. */
    static final Map<String, String> REQUIRED_SECTIONS;

    static {
        var required = new LinkedHashMap<String, String>();
        required.put(ProposalState.REFINED_SCOPE, "refined scope");
        required.put(ProposalState.BUSINESS_ANALYSIS, "business analysis");
        required.put(ProposalState.TECHNICAL_SPEC, "technical specification");
        required.put(ProposalState.PROJECT_PLAN, "project plan");
        required.put(ProposalState.RESOURCE_PLAN, "resource plan");
        REQUIRED_SECTIONS = Collections.unmodifiableMap(required);
    }

    @Override
    public AgentId id() {
        return AgentId.FINAL_COMPILATION;
    }

    @Override
    public Map<String, Object> run(ProposalState snapshot) {
        var missing = new ArrayList<String>();
        REQUIRED_SECTIONS.forEach((key, name) -> {
            if (!snapshot.hasContent(key)) {
                missing.add(name);
            }
        });

        if (!missing.isEmpty()) {
            String message = "Cannot compile proposal, missing: " + String.join(", ", missing);
            log.warn(message);
            return Map.of(
                    ProposalState.STAGE, PipelineStage.FAILED.name(),
                    ProposalState.ERROR, message);
        }

        var document = new LinkedHashMap<String, Object>();
        String title = snapshot.proposalTitle();
        document.put("title", title.isBlank() ? TitleAgent.DEFAULT_TITLE : title);
        document.put(ProposalState.INITIAL_IDEA, snapshot.initialIdea());
        document.put(ProposalState.SIMILAR_PRODUCTS, snapshot.text(ProposalState.SIMILAR_PRODUCTS));
        for (String key : REQUIRED_SECTIONS.keySet()) {
            document.put(key, snapshot.text(key));
        }
        log.info("Compiled proposal '{}' with {} sections", document.get("title"), REQUIRED_SECTIONS.size());
        return Map.of(
                ProposalState.FINAL_PROPOSAL, document,
                ProposalState.STAGE, PipelineStage.COMPLETED.name(),
                ProposalState.ERROR, "");
    }
}
