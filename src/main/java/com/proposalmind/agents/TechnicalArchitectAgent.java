package com.proposalmind.agents;

import com.proposalmind.core.llm.LlmService;
import com.proposalmind.core.model.AgentId;
import org.springframework.stereotype.Component;

@Component
public class TechnicalArchitectAgent extends AbstractSectionAgent {

    private static final String SYSTEM_PROMPT = """
            You are a software architect.
            Write the technical specification of a software proposal: architecture overview,
            technology stack with reasons, main components, data model, APIs and integrations,
            hosting and security considerations.
            """;

    public TechnicalArchitectAgent(LlmService llmService) {
        super(llmService);
    }

    @Override
    public AgentId id() {
        return AgentId.TECHNICAL_ARCHITECT;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }
}
