package org.iceforge.warden.audit;

import org.iceforge.warden.error.ErrorKind;
import org.iceforge.warden.pipeline.PipelineState;
import org.iceforge.warden.pipeline.QueryStatus;

import java.time.Instant;

/**
 * One terminal request outcome.
 *
 * @param sql          the SQL as far as it got: rewritten when authorized, else the submitted text
 * @param errorKind    null on success
 * @param errorMessage null on success
 */
public record AuditRecord(
        String userId,
        String question,
        String sql,
        QueryStatus status,
        PipelineState finalState,
        ErrorKind errorKind,
        String errorMessage,
        int rowCount,
        long executionTimeMs,
        boolean cached,
        Instant createdAt) {}
