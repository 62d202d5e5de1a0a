package com.proposalmind.core.model;

/**
 * Status of an individual agent within a pipeline run.
 */
public enum AgentStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED
}
