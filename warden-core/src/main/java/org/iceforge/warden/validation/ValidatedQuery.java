package org.iceforge.warden.validation;

import org.iceforge.warden.sql.ComplexityScore;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link SqlValidator}: the statement in canonical layout plus observability annotations.
 */
public record ValidatedQuery(String normalizedSql, ComplexityScore complexity, List<String> warnings) {

    public ValidatedQuery {
        Objects.requireNonNull(normalizedSql, "normalizedSql");
        Objects.requireNonNull(complexity, "complexity");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
