package com.proposalmind.agents;

import com.proposalmind.core.llm.LlmResponses;
import com.proposalmind.core.llm.LlmService;
import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.state.ProposalState;

import java.util.Map;

/**
 * Base for agents that write one markdown section with a single model call.
 * <p>
 * The prompt carries the initial idea, the user's instruction for this turn,
 * the agent's own previous section (so an edit rewrites rather than restarts)
 * and the sections of the agents it depends on.
 */
public abstract class AbstractSectionAgent implements ProposalAgent {

    static final String NO_IDEA = "No initial idea was provided.";
    static final String NOT_AVAILABLE = "(not available yet)";

    protected final LlmService llmService;

    protected AbstractSectionAgent(LlmService llmService) {
        this.llmService = llmService;
    }

    protected abstract String systemPrompt();

    /** Agent-specific context such as rates or budget; empty by default. */
    protected String extraContext(ProposalState snapshot) {
        return "";
    }

    @Override
    public Map<String, Object> run(ProposalState snapshot) {
        String response = llmService.call(systemPrompt(), buildPrompt(snapshot), id().id());
        return toOutput(LlmResponses.stripCodeFences(response));
    }

    protected Map<String, Object> toOutput(String content) {
        return Map.of(id().primaryOutputKey(), content);
    }

    String buildPrompt(ProposalState snapshot) {
        var sb = new StringBuilder();
        String idea = snapshot.initialIdea();
        sb.append("## Project Idea\n\n").append(idea.isBlank() ? NO_IDEA : idea).append("\n\n");

        String title = snapshot.proposalTitle();
        if (!title.isBlank()) {
            sb.append("## Proposal Title\n\n").append(title).append("\n\n");
        }

        for (AgentId dependency : id().dependencies()) {
            String key = dependency.primaryOutputKey();
            String content = snapshot.text(key);
            sb.append("## ").append(dependency.displayName()).append("\n\n")
              .append(content.isBlank() ? NOT_AVAILABLE : content).append("\n\n");
        }

        String extra = extraContext(snapshot);
        if (!extra.isBlank()) {
            sb.append(extra).append("\n\n");
        }

        String previous = snapshot.text(id().primaryOutputKey());
        String instruction = snapshot.userInput();
        if (!previous.isBlank()) {
            sb.append("## Current ").append(id().displayName()).append(" Section\n\n")
              .append(previous).append("\n\n")
              .append("Revise the current section. Keep what still holds and change what the instruction asks for.\n\n");
        }
        if (!instruction.isBlank()) {
            sb.append("## Instruction\n\n").append(instruction).append("\n\n");
        }
        String standing = snapshot.settings().freeTextInstructions();
        if (!standing.isBlank()) {
            sb.append("## Standing Instructions\n\n").append(standing).append("\n\n");
        }
        sb.append("Respond with the section content in markdown only.");
        return sb.toString();
    }

    /** Budget and timeline lines, when the user has given either. */
    static String constraintsBlock(ProposalState snapshot) {
        var sb = new StringBuilder();
        if (!snapshot.budget().isBlank()) {
            sb.append("- Budget: ").append(snapshot.budget()).append('\n');
        }
        if (!snapshot.timeline().isBlank()) {
            sb.append("- Timeline: ").append(snapshot.timeline()).append('\n');
        }
        if (sb.length() == 0) {
            return "";
        }
        return "## Client Constraints (must be respected)\n\n" + sb;
    }
}
