package org.iceforge.warden.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;
import org.iceforge.warden.error.ErrorKind;

/** Envelope status reported to callers. */
public enum QueryStatus {
    SUCCESS("success"),
    VALIDATION_ERROR("validation_error"),
    PERMISSION_DENIED("permission_denied"),
    RATE_LIMIT("rate_limit"),
    TIMEOUT("timeout"),
    FAILED("failed");

    private final String wireName;

    QueryStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** {@code sql_error} and {@code server_error} both surface as {@link #FAILED}; the error record keeps the kind. */
    public static QueryStatus of(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR -> VALIDATION_ERROR;
            case PERMISSION_DENIED -> PERMISSION_DENIED;
            case RATE_LIMIT -> RATE_LIMIT;
            case TIMEOUT -> TIMEOUT;
            case SQL_ERROR, SERVER_ERROR -> FAILED;
        };
    }
}
