package org.iceforge.warden.error;

import java.util.Objects;

/**
 * Base type for every failure a pipeline stage can raise. The orchestrator catches these and turns them into a
 * terminal state; nothing above it sees them.
 */
public class QueryPipelineException extends RuntimeException {

    private final ErrorKind kind;

    public QueryPipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public QueryPipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean retriable() {
        return kind.retriable();
    }
}
