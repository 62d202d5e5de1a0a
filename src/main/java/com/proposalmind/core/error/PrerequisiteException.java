package com.proposalmind.core.error;

/**
 * Thrown (or returned as a run's terminal error) when a pipeline's prerequisites
 * are not met. No agent has been dispatched when this is raised.
 */
public class PrerequisiteException extends ProposalmindException {

    public PrerequisiteException(String message) {
        super(message);
    }
}
