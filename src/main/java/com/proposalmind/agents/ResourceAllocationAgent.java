package com.proposalmind.agents;

import com.proposalmind.core.llm.LlmService;
import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.state.ProposalState;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.TreeMap;

/**
 * Staffs the project plan and costs it with the merged hourly rates.
 */
@Component
public class ResourceAllocationAgent extends AbstractSectionAgent {

    private static final String SYSTEM_PROMPT = """
            You are a resource planner for a software consultancy.
            Write the resource plan section of a proposal: team composition per phase,
            estimated hours per role, cost per role and the total cost.
            Use exactly the hourly rates provided. If a budget is given, the total must not exceed it;
            if it cannot be met, say so and propose a reduced scope.
            """;

    public ResourceAllocationAgent(LlmService llmService) {
        super(llmService);
    }

    @Override
    public AgentId id() {
        return AgentId.RESOURCE_ALLOCATION;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String extraContext(ProposalState snapshot) {
        var settings = snapshot.settings();
        var sb = new StringBuilder();
        if (!settings.rates().isEmpty()) {
            sb.append("## Hourly Rates (").append(settings.currency()).append(")\n\n");
            new TreeMap<>(settings.rates()).forEach((role, rate) ->
                    sb.append("- ").append(role).append(": ")
                      .append(String.format(Locale.ROOT, "%.2f", rate)).append('\n'));
            sb.append('\n');
        }
        sb.append(constraintsBlock(snapshot));
        return sb.toString().trim();
    }
}
