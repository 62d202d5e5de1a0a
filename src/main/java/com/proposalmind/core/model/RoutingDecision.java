package com.proposalmind.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Verdict of the request router for one user turn. Matches the JSON wire shape
 * the classifier is asked to produce.
 *
 * @param action              what the turn should cause
 * @param taskIds             agents to (re)run, duplicates removed, order kept
 * @param relevantSections    sections a conversational answer should draw on
 * @param reasoning           the classifier's explanation
 * @param confidence          0..1
 * @param needsFullGeneration whether a full proposal run is required
 * @param extractedSettings   rates, budget and timeline mentioned in the turn
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingDecision(
    @JsonProperty("action") RoutingAction action,
    @JsonProperty("task_ids") @JsonAlias("agents_to_rerun") List<String> taskIds,
    @JsonProperty("relevant_sections") @JsonAlias("relevant_context_sections") List<String> relevantSections,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("needs_full_generation") @JsonAlias("needs_proposal_generation") boolean needsFullGeneration,
    @JsonProperty("extracted_settings") ExtractedSettings extractedSettings
) implements Serializable {

    public RoutingDecision {
        action = action != null ? action : RoutingAction.CONVERSATION;
        taskIds = taskIds != null ? List.copyOf(new LinkedHashSet<>(taskIds)) : List.of();
        relevantSections = relevantSections != null ? List.copyOf(relevantSections) : List.of();
        reasoning = reasoning != null ? reasoning : "";
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        extractedSettings = extractedSettings != null ? extractedSettings : ExtractedSettings.EMPTY;
    }

    public static RoutingDecision conversation(String reasoning, double confidence) {
        return new RoutingDecision(RoutingAction.CONVERSATION, List.of(), List.of(),
                reasoning, confidence, false, ExtractedSettings.EMPTY);
    }

    public static RoutingDecision generate(String reasoning) {
        return new RoutingDecision(RoutingAction.GENERATE, List.of(), List.of(),
                reasoning, 1.0, true, ExtractedSettings.EMPTY);
    }

    public static RoutingDecision edit(List<String> taskIds, String reasoning, double confidence) {
        return new RoutingDecision(RoutingAction.EDIT, taskIds, List.of(),
                reasoning, confidence, false, ExtractedSettings.EMPTY);
    }

    /** Copy with {@code taskId} appended (if absent) and the action forced to edit. */
    public RoutingDecision withInjectedTask(String taskId) {
        var ids = new ArrayList<>(taskIds);
        if (!ids.contains(taskId)) {
            ids.add(taskId);
        }
        return new RoutingDecision(RoutingAction.EDIT, ids, relevantSections, reasoning, confidence,
                needsFullGeneration, extractedSettings);
    }
}
