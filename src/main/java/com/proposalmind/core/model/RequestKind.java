package com.proposalmind.core.model;

/**
 * How an agent set was requested. Only an explicit edit naming exactly one agent
 * bypasses dependency expansion.
 */
public enum RequestKind {
    EXPLICIT_EDIT,
    FULL_GENERATION;

    public static RequestKind forAction(RoutingAction action) {
        return action == RoutingAction.GENERATE ? FULL_GENERATION : EXPLICIT_EDIT;
    }
}
