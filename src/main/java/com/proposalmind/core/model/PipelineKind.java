package com.proposalmind.core.model;

/**
 * The two pipeline shapes. Full proposals use fixed levels (title, content, compile);
 * edits compute levels from the dependency graph of the selected agents.
 */
public enum PipelineKind {
    FULL_PROPOSAL("Full Proposal Pipeline"),
    EDIT("Edit Pipeline");

    private final String displayName;

    PipelineKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
