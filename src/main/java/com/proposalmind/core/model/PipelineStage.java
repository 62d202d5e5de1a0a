package com.proposalmind.core.model;

/**
 * Lifecycle stage of a pipeline run. {@code COMPLETED} and {@code FAILED} are terminal.
 */
public enum PipelineStage {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
