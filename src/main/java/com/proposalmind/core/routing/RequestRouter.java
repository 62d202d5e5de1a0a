package com.proposalmind.core.routing;

import com.proposalmind.config.ProposalmindProperties;
import com.proposalmind.core.error.RoutingParseException;
import com.proposalmind.core.llm.LlmService;
import com.proposalmind.core.metrics.ProposalMetrics;
import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.ConversationMessage;
import com.proposalmind.core.model.RoutingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides what a user turn should cause: a conversational reply, an edit of some
 * sections, or generation of the whole proposal.
 * <p>
 * Explicit generation phrases and bare greetings are decided locally. Everything
 * else goes to the model classifier; if that call fails or its output cannot be
 * read, a keyword table picks the sections instead.
 */
@Service
public class RequestRouter {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    static final double FALLBACK_CONFIDENCE = 0.7;

    private static final List<String> GENERATE_PHRASES = List.of(
            "generate proposal", "go ahead", "proceed", "create proposal", "make proposal",
            "let's go", "lets go", "start proposal", "build proposal");

    // Whole word only: "regenerate the scope" is an edit
    private static final Pattern GENERATE_WORD = Pattern.compile("\\bgenerate\\b");

    private static final List<String> GREETINGS = List.of(
            "hello", "hi", "hey", "greetings", "good morning", "good afternoon", "good evening");

    private static final String SYSTEM_PROMPT = """
            You route messages for a multi-agent software proposal writer.
            Decide what the user's latest message should trigger:
            - "conversation": a question or remark that needs an answer but no document change
            - "edit": change specific sections; list the agents that own them in task_ids
            - "generate": write the whole proposal

            Also extract any settings the user states, whatever the action:
            - rates: role -> {"value": number, "unit": "hour" | "day" | "week" | "month"}
              roles: senior_engineer, mid_level_engineer, junior_engineer, ui_ux_designer,
              devops_engineer, ai_engineer, project_manager
            - budget: the total budget as written, e.g. "$25,000"
            - timeline: the timeline as written, e.g. "3 months"

            Respond with only a JSON object:
            {"action": "...", "task_ids": [], "relevant_sections": [], "reasoning": "...",
             "confidence": 0.0, "needs_full_generation": false,
             "extracted_settings": {"rates": {}, "budget": null, "timeline": null}}
            """;

    private final LlmService llmService;
    private final ProposalMetrics metrics;
    private final int historyWindow;

    @Autowired
    public RequestRouter(LlmService llmService, ProposalMetrics metrics, ProposalmindProperties properties) {
        this(llmService, metrics, properties.getHistoryWindow());
    }

    RequestRouter(LlmService llmService, ProposalMetrics metrics, int historyWindow) {
        this.llmService = llmService;
        this.metrics = metrics;
        this.historyWindow = historyWindow;
    }

    public RoutingDecision route(RoutingContext context) {
        String utterance = context.utterance();
        String lower = utterance.toLowerCase(Locale.ROOT).trim();

        if (isGenerateRequest(lower)) {
            log.info("Routing: explicit generation request");
            return record(RoutingDecision.generate("Explicit request to generate the proposal"), "fast_path");
        }

        if (isBareGreeting(utterance)) {
            log.info("Routing: greeting");
            return record(RoutingDecision.conversation("Greeting", 1.0), "greeting");
        }

        try {
            String response = llmService.call(SYSTEM_PROMPT, buildPrompt(context), "routing");
            var decision = RoutingDecisionParser.parse(response);
            log.info("Routing: {} {} (confidence {}) - {}", decision.action().wireName(),
                    decision.taskIds(), decision.confidence(), decision.reasoning());
            return record(decision, "model");
        } catch (RoutingParseException e) {
            log.warn("Routing output unreadable, using keyword fallback: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Routing call failed, using keyword fallback: {}", e.getMessage());
        }
        return record(keywordFallback(utterance), "fallback");
    }

    /**
     * A trigger phrase always means full generation. The bare word "generate"
     * does only when no section is named, so "generate a new market analysis"
     * is left to the classifier.
     */
    boolean isGenerateRequest(String lower) {
        if (GENERATE_PHRASES.stream().anyMatch(lower::contains)) {
            return true;
        }
        return GENERATE_WORD.matcher(lower).find() && AgentResponsibilities.matching(lower).isEmpty();
    }

    boolean isBareGreeting(String utterance) {
        boolean greeting = GREETINGS.stream()
                .anyMatch(g -> AgentResponsibilities.containsPhrase(utterance, g));
        return greeting && AgentResponsibilities.matching(utterance).isEmpty();
    }

    RoutingDecision keywordFallback(String utterance) {
        var matched = AgentResponsibilities.matching(utterance);
        if (matched.isEmpty()) {
            return RoutingDecision.conversation("No section keywords found", 0.5);
        }
        var ids = matched.stream().map(AgentId::id).toList();
        return RoutingDecision.edit(ids, "Keyword match: " + ids, FALLBACK_CONFIDENCE);
    }

    String buildPrompt(RoutingContext context) {
        var sb = new StringBuilder();
        sb.append("User message: ").append(context.utterance()).append("\n\n");
        sb.append("Proposal already generated: ").append(context.documentExists() ? "yes" : "no").append("\n\n");

        var history = context.recentHistory();
        var recent = history.subList(Math.max(0, history.size() - historyWindow), history.size());
        if (!recent.isEmpty()) {
            sb.append("Recent conversation:\n");
            for (ConversationMessage message : recent) {
                sb.append("- ").append(message.role()).append(": ").append(message.message()).append('\n');
            }
            sb.append('\n');
        }

        sb.append("Agents (task_ids):\n");
        for (var agent : AgentId.contentAgents()) {
            sb.append("- ").append(agent.id()).append(": ")
              .append(AgentResponsibilities.describe(agent)).append('\n');
        }
        return sb.toString();
    }

    private RoutingDecision record(RoutingDecision decision, String source) {
        if (metrics != null) {
            metrics.recordRoutingDecision(decision.action().wireName(), source);
        }
        return decision;
    }
}
