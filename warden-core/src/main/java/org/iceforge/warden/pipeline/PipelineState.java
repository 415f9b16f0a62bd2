package org.iceforge.warden.pipeline;

/**
 * Stages of one request. Progress is strictly forward; a failure jumps straight to {@link #REJECTED} (rate limit,
 * validation, authorization) or {@link #FAILED} (execution and infrastructure).
 */
public enum PipelineState {
    RECEIVED,
    VALIDATED,
    AUTHORIZED,
    CACHE_CHECKED,
    CACHE_HIT,
    EXECUTING,
    COMPLETED,
    REJECTED,
    FAILED;

    public boolean terminal() {
        return this == COMPLETED || this == REJECTED || this == FAILED;
    }
}
