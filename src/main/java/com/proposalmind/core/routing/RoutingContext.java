package com.proposalmind.core.routing;

import com.proposalmind.core.model.ConversationMessage;

import java.util.List;

/**
 * What the router knows about a turn.
 *
 * @param utterance      the user's message
 * @param documentExists whether a full proposal has been generated for the session
 * @param recentHistory  the most recent conversation entries, oldest first
 */
public record RoutingContext(
    String utterance,
    boolean documentExists,
    List<ConversationMessage> recentHistory
) {

    public RoutingContext {
        utterance = utterance != null ? utterance : "";
        recentHistory = recentHistory != null ? List.copyOf(recentHistory) : List.of();
    }
}
