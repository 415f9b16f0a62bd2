package org.iceforge.warden.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Error payload carried by a failed {@code QueryResponse}.
 *
 * @param retryAfterSeconds only set for {@link ErrorKind#RATE_LIMIT}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorRecord(ErrorKind kind, String message, boolean retriable, Long retryAfterSeconds) {

    public ErrorRecord {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }

    public static ErrorRecord from(QueryPipelineException e) {
        Long retryAfter = e instanceof RateLimitExceededException rl ? rl.retryAfterSeconds() : null;
        return new ErrorRecord(e.kind(), e.getMessage(), e.kind().retriable(), retryAfter);
    }
}
