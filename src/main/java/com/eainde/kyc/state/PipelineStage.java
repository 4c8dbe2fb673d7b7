package com.eainde.kyc.state;

/**
 * Stages of a single verification. Transitions only move forward.
 */
public enum PipelineStage {
    RECEIVED,
    REJECTED,
    FEATURES_EXTRACTED,
    SCORED,
    CLASSIFIED,
    LOGGED,
    PERSISTENCE_FAILED,
    COMPLETED,
    DEGRADED_COMPLETED;

    public boolean isTerminal() {
        return this == REJECTED || this == PERSISTENCE_FAILED || this == COMPLETED || this == DEGRADED_COMPLETED;
    }
}
