package com.proposalmind.agents;

import com.proposalmind.core.llm.LlmService;
import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.state.ProposalState;
import org.springframework.stereotype.Component;

/**
 * Writes the delivery plan. A budget or timeline the client gave is a hard constraint.
 */
@Component
public class ProjectManagerAgent extends AbstractSectionAgent {

    private static final String SYSTEM_PROMPT = """
            You are an experienced software project manager.
            Write the project plan section of a proposal: phases, milestones with durations,
            deliverables per phase, dependencies and main delivery risks.
            If the client gave a timeline or budget, the plan must fit inside it.
            """;

    public ProjectManagerAgent(LlmService llmService) {
        super(llmService);
    }

    @Override
    public AgentId id() {
        return AgentId.PROJECT_MANAGER;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String extraContext(ProposalState snapshot) {
        return constraintsBlock(snapshot);
    }
}
