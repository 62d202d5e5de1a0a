package com.proposalmind.core.engine;

import com.proposalmind.core.llm.LlmService;
import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.RoutingDecision;
import com.proposalmind.core.routing.AgentResponsibilities;
import com.proposalmind.core.session.ProposalSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Answers conversational turns from the sections the question is about.
 */
@Service
public class ConversationResponder {

    private static final Logger log = LoggerFactory.getLogger(ConversationResponder.class);

    static final String FALLBACK_REPLY =
            "I can help you shape your proposal. Describe your project idea, ask about a section, "
            + "or say \"generate proposal\" when you are ready.";

    private static final String SYSTEM_PROMPT = """
            You are a friendly proposal consultant discussing a software project proposal with a client.
            Answer briefly and concretely. Use the proposal sections provided when they are relevant.
            Do not invent sections that do not exist yet; suggest generating the proposal instead.
            """;

    private final LlmService llmService;

    public ConversationResponder(LlmService llmService) {
        this.llmService = llmService;
    }

    public String respond(ProposalSession session, String utterance, RoutingDecision decision) {
        var sb = new StringBuilder();
        String idea = session.getInitialIdea();
        if (!idea.isBlank()) {
            sb.append("## Project Idea\n\n").append(idea).append("\n\n");
        }
        if (!session.getDocumentTitle().isBlank()) {
            sb.append("## Proposal Title\n\n").append(session.getDocumentTitle()).append("\n\n");
        }
        for (var agent : relevantAgents(utterance, decision)) {
            session.getPriorTaskOutput(agent).ifPresent(content ->
                    sb.append("## ").append(agent.displayName()).append("\n\n").append(content).append("\n\n"));
        }
        sb.append("## Client Message\n\n").append(utterance);

        try {
            return llmService.call(SYSTEM_PROMPT, sb.toString(), "conversation").trim();
        } catch (RuntimeException e) {
            log.warn("Conversation reply failed, using canned reply: {}", e.getMessage());
            return FALLBACK_REPLY;
        }
    }

    /**
     * Sections named by the classifier, or by keyword match when it named none.
     */
    Set<AgentId> relevantAgents(String utterance, RoutingDecision decision) {
        var agents = EnumSet.noneOf(AgentId.class);
        for (String section : decision.relevantSections()) {
            String normalized = section.trim().toLowerCase(Locale.ROOT);
            for (var agent : AgentId.contentAgents()) {
                if (agent.id().equals(normalized) || agent.outputKeys().contains(normalized)) {
                    agents.add(agent);
                }
            }
        }
        if (agents.isEmpty()) {
            agents.addAll(AgentResponsibilities.matching(utterance));
        }
        return agents;
    }
}
