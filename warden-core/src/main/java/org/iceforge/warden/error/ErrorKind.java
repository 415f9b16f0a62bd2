package org.iceforge.warden.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure taxonomy shared by every pipeline stage.
 *
 * <p>{@code retriable} tells the caller whether trying again later can succeed. The pipeline itself never retries.
 */
public enum ErrorKind {
    VALIDATION_ERROR("validation_error", false),
    PERMISSION_DENIED("permission_denied", false),
    RATE_LIMIT("rate_limit", true),
    TIMEOUT("timeout", true),
    SQL_ERROR("sql_error", false),
    SERVER_ERROR("server_error", true);

    private final String wireName;
    private final boolean retriable;

    ErrorKind(String wireName, boolean retriable) {
        this.wireName = wireName;
        this.retriable = retriable;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean retriable() {
        return retriable;
    }
}
