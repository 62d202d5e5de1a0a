package com.proposalmind.core.engine;

import com.proposalmind.core.state.ProposalState;

import java.util.Optional;

/**
 * Checked before any level is dispatched. Returns a description of the first
 * unmet prerequisite, or empty when the run may proceed.
 */
@FunctionalInterface
public interface PrerequisiteCheck {

    Optional<String> check(ProposalState state);

    static PrerequisiteCheck none() {
        return state -> Optional.empty();
    }

    static PrerequisiteCheck requireInitialIdea() {
        return state -> state.initialIdea().isBlank()
                ? Optional.of("An initial project idea is required before a proposal can be generated")
                : Optional.empty();
    }
}
