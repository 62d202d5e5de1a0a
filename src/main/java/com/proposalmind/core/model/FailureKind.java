package com.proposalmind.core.model;

/**
 * Why a pipeline run ended in {@link PipelineStage#FAILED}.
 */
public enum FailureKind {
    NONE,
    PREREQUISITE,
    AGENT,
    INCOMPLETE
}
