package org.iceforge.warden.exec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * @param parameters positional bind values; null elements bind SQL NULL
 * @param rowLimit   maximum rows returned; one extra row is fetched to detect truncation
 * @param timeout    hard ceiling for the statement
 */
public record ExecutionRequest(String sql, List<Object> parameters, int rowLimit, Duration timeout) {

    public ExecutionRequest {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(timeout, "timeout");
        if (rowLimit <= 0) throw new IllegalArgumentException("rowLimit must be > 0");
        if (timeout.isZero() || timeout.isNegative()) throw new IllegalArgumentException("timeout must be > 0");
        parameters = parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
    }
}
