package org.iceforge.warden.sql;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Observability-only estimate; never used to reject a statement. */
public record ComplexityScore(int joins, int subqueryDepth, int aggregates, boolean orderBy, int score, Level level) {

    public enum Level {
        LOW, MEDIUM, HIGH;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static ComplexityScore of(int joins, int subqueryDepth, int aggregates, boolean orderBy) {
        int score = joins * 2 + subqueryDepth * 3 + aggregates + (orderBy ? 1 : 0);
        Level level = score >= 5 ? Level.HIGH : score >= 3 ? Level.MEDIUM : Level.LOW;
        return new ComplexityScore(joins, subqueryDepth, aggregates, orderBy, score, level);
    }
}
