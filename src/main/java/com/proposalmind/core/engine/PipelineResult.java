package com.proposalmind.core.engine;

import com.proposalmind.core.error.ProposalmindException;
import com.proposalmind.core.model.FailureKind;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.state.ProposalState;

import java.util.Optional;

/**
 * Outcome of one pipeline run.
 *
 * @param state       final state of the run
 * @param stage       {@link PipelineStage#COMPLETED} or {@link PipelineStage#FAILED}
 * @param failureKind why the run failed, {@link FailureKind#NONE} on success
 * @param error       the terminal error for prerequisite and agent failures;
 *                    {@code null} on success and for incomplete content
 */
public record PipelineResult(
    ProposalState state,
    PipelineStage stage,
    FailureKind failureKind,
    ProposalmindException error
) {

    public boolean succeeded() {
        return stage == PipelineStage.COMPLETED;
    }

    public Optional<ProposalmindException> errorIfAny() {
        return Optional.ofNullable(error);
    }

    /** Human-readable reason for a failed run, or empty on success. */
    public Optional<String> failureMessage() {
        if (succeeded()) {
            return Optional.empty();
        }
        if (error != null) {
            return Optional.of(error.getMessage());
        }
        return Optional.of(state.error().orElse("Pipeline failed"));
    }
}
