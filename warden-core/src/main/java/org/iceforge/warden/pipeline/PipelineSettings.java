package org.iceforge.warden.pipeline;

import java.time.Duration;

/**
 * @param maxRows          row ceiling; a smaller per-request limit is honored, a larger one is capped
 * @param executionTimeout ceiling for the execution stage
 * @param requestDeadline  overall budget; execution is not started once it has elapsed
 */
public record PipelineSettings(int maxRows, Duration executionTimeout, Duration requestDeadline) {

    public static final int DEFAULT_MAX_ROWS = 1000;
    public static final Duration DEFAULT_EXECUTION_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_REQUEST_DEADLINE = Duration.ofSeconds(35);

    public PipelineSettings {
        if (maxRows <= 0) maxRows = DEFAULT_MAX_ROWS;
        if (executionTimeout == null || executionTimeout.isZero() || executionTimeout.isNegative()) {
            executionTimeout = DEFAULT_EXECUTION_TIMEOUT;
        }
        if (requestDeadline == null || requestDeadline.isZero() || requestDeadline.isNegative()) {
            requestDeadline = DEFAULT_REQUEST_DEADLINE;
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(DEFAULT_MAX_ROWS, DEFAULT_EXECUTION_TIMEOUT, DEFAULT_REQUEST_DEADLINE);
    }

    public int effectiveRowLimit(Integer requested) {
        if (requested == null || requested <= 0) return maxRows;
        return Math.min(requested, maxRows);
    }
}
