package com.proposalmind.core.routing;

import com.proposalmind.core.model.AgentId;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * What each content agent is responsible for: a description given to the
 * classifier and the keywords used when the classifier is unavailable.
 */
public final class AgentResponsibilities {

    private static final Map<AgentId, String> DESCRIPTIONS = new EnumMap<>(AgentId.class);
    private static final Map<AgentId, List<String>> KEYWORDS = new EnumMap<>(AgentId.class);

    static {
        DESCRIPTIONS.put(AgentId.TITLE, "the proposal title");
        DESCRIPTIONS.put(AgentId.SCOPE_REFINEMENT,
                "project scope, core idea, requirements, features and similar products");
        DESCRIPTIONS.put(AgentId.BUSINESS_ANALYST,
                "market analysis, target customers, competition, revenue model and ROI");
        DESCRIPTIONS.put(AgentId.TECHNICAL_ARCHITECT,
                "architecture, technology stack, frameworks, APIs, database, backend and frontend");
        DESCRIPTIONS.put(AgentId.PROJECT_MANAGER,
                "timeline, phases, milestones, deadlines and delivery planning");
        DESCRIPTIONS.put(AgentId.RESOURCE_ALLOCATION,
                "team composition, hourly rates, budget and cost breakdown");

        KEYWORDS.put(AgentId.TITLE, List.of("title", "name of the proposal", "rename"));
        KEYWORDS.put(AgentId.SCOPE_REFINEMENT, List.of(
                "idea", "concept", "scope", "requirements", "features", "functionality",
                "what", "purpose", "goal"));
        KEYWORDS.put(AgentId.BUSINESS_ANALYST, List.of(
                "business", "market", "roi", "revenue", "profit", "cost", "benefit", "value",
                "competition", "target audience", "customer"));
        KEYWORDS.put(AgentId.TECHNICAL_ARCHITECT, List.of(
                "technical", "technology", "tech stack", "architecture", "framework", "api",
                "database", "backend", "frontend", "server"));
        KEYWORDS.put(AgentId.PROJECT_MANAGER, List.of(
                "timeline", "schedule", "deadline", "milestone", "phase", "delivery",
                "planning", "project plan"));
        KEYWORDS.put(AgentId.RESOURCE_ALLOCATION, List.of(
                "budget", "cost", "price", "rate", "hourly", "salary", "team", "resource",
                "engineer", "developer", "designer", "dollar", "usd", "money", "expense"));
    }

    private AgentResponsibilities() {}

    public static String describe(AgentId agent) {
        return DESCRIPTIONS.getOrDefault(agent, agent.displayName());
    }

    /** Agents with at least one keyword in {@code text}, in canonical order. */
    public static List<AgentId> matching(String text) {
        var matched = new ArrayList<AgentId>();
        for (var entry : KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (containsPhrase(text, keyword)) {
                    matched.add(entry.getKey());
                    break;
                }
            }
        }
        return matched;
    }

    /**
     * Whole-word, case-insensitive phrase match, so that "hi" does not match "this".
     * A trailing plural "s" is allowed.
     */
    static boolean containsPhrase(String text, String phrase) {
        if (text == null || text.isBlank()) {
            return false;
        }
        var pattern = Pattern.compile("\\b" + Pattern.quote(phrase.toLowerCase(Locale.ROOT)) + "s?\\b");
        return pattern.matcher(text.toLowerCase(Locale.ROOT)).find();
    }
}
