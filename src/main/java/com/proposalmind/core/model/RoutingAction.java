package com.proposalmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Terminal action of a routed user turn.
 */
public enum RoutingAction {
    CONVERSATION("conversation"),
    EDIT("edit"),
    GENERATE("generate");

    private final String wireName;

    RoutingAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Lenient wire mapping. Models sometimes answer {@code generate_proposal};
     * anything unrecognised is treated as conversation.
     */
    @JsonCreator
    public static RoutingAction fromWire(String raw) {
        if (raw == null) {
            return CONVERSATION;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("generate")) {
            return GENERATE;
        }
        if (normalized.equals("edit")) {
            return EDIT;
        }
        return CONVERSATION;
    }
}
