package com.proposalmind.agents;

import com.proposalmind.core.llm.LlmResponses;
import com.proposalmind.core.llm.LlmService;
import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.state.ProposalState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Produces a short proposal title. Its output is persisted to the session as soon
 * as it completes, ahead of the rest of its level.
 */
@Component
public class TitleAgent extends AbstractSectionAgent {

    static final int MAX_LENGTH = 120;
    static final String DEFAULT_TITLE = "Project Proposal";

    private static final String SYSTEM_PROMPT = """
            You name software project proposals.
            Reply with a single concise, professional title of at most ten words.
            No quotes, no markdown, no explanation.
            """;

    public TitleAgent(LlmService llmService) {
        super(llmService);
    }

    @Override
    public AgentId id() {
        return AgentId.TITLE;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    public Map<String, Object> run(ProposalState snapshot) {
        String response = llmService.call(SYSTEM_PROMPT, titlePrompt(snapshot), id().id());
        return Map.of(id().primaryOutputKey(), clean(response));
    }

    String titlePrompt(ProposalState snapshot) {
        String idea = snapshot.initialIdea().isBlank() ? NO_IDEA : snapshot.initialIdea();
        String current = snapshot.proposalTitle();
        String instruction = snapshot.userInput();
        if (!current.isBlank() && !instruction.isBlank()) {
            return "Project idea: " + idea + "\n\nCurrent title: " + current
                    + "\n\nThe user asked: " + instruction
                    + "\n\nWrite the new title.";
        }
        return "Project idea: " + idea + "\n\nWrite the title.";
    }

    static String clean(String response) {
        String text = LlmResponses.stripCodeFences(response);
        String firstLine = text.lines().map(String::trim).filter(l -> !l.isEmpty()).findFirst().orElse("");
        if (firstLine.regionMatches(true, 0, "title:", 0, 6)) {
            firstLine = firstLine.substring(6).trim();
        }
        firstLine = firstLine.replaceAll("^[#*\\s]+", "").replaceAll("^[\"'`]+|[\"'`]+$", "").trim();
        if (firstLine.length() > MAX_LENGTH) {
            firstLine = firstLine.substring(0, MAX_LENGTH).trim();
        }
        return firstLine.isEmpty() ? DEFAULT_TITLE : firstLine;
    }
}
