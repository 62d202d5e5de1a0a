package com.proposalmind.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry of a session's conversation history.
 *
 * @param role      "user" or "assistant"
 * @param message   the message text
 * @param timestamp when the message was recorded
 */
public record ConversationMessage(
    String role,
    String message,
    Instant timestamp
) implements Serializable {

    public static ConversationMessage user(String message) {
        return new ConversationMessage("user", message, Instant.now());
    }

    public static ConversationMessage assistant(String message) {
        return new ConversationMessage("assistant", message, Instant.now());
    }
}
