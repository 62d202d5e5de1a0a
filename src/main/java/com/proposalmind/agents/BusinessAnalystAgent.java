package com.proposalmind.agents;

import com.proposalmind.core.llm.LlmService;
import com.proposalmind.core.model.AgentId;
import org.springframework.stereotype.Component;

@Component
public class BusinessAnalystAgent extends AbstractSectionAgent {

    private static final String SYSTEM_PROMPT = """
            You are a senior business analyst.
            Write the business analysis section of a software proposal: target market and customers,
            competition, value proposition, revenue model and expected return on investment.
            """;

    public BusinessAnalystAgent(LlmService llmService) {
        super(llmService);
    }

    @Override
    public AgentId id() {
        return AgentId.BUSINESS_ANALYST;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }
}
