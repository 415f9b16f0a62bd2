package org.iceforge.warden.exec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.temporal.TemporalAccessor;
import java.util.Base64;

/**
 * Maps driver values onto JSON-friendly types: integral numbers to {@link Long}, other numbers to {@link BigDecimal}
 * (exact values keep their digits and scale), dates and times to ISO-8601 strings, binary to base64. Booleans,
 * strings and null pass through.
 */
final class JdbcValues {
    private JdbcValues() {
    }

    static Object normalize(Object v) {
        if (v == null || v instanceof String || v instanceof Boolean) return v;
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if (v instanceof BigInteger bi) {
            return bi.bitLength() < 64 ? (Object) bi.longValue() : bi.toString();
        }
        if (v instanceof BigDecimal) return v;
        if (v instanceof Double || v instanceof Float) {
            double d = ((Number) v).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return v.toString();
            return v instanceof Float ? new BigDecimal(v.toString()) : BigDecimal.valueOf(d);
        }
        if (v instanceof Timestamp ts) return ts.toLocalDateTime().toString();
        if (v instanceof Date d) return d.toLocalDate().toString();
        if (v instanceof Time t) return t.toLocalTime().toString();
        if (v instanceof TemporalAccessor) return v.toString();
        if (v instanceof byte[] bytes) return Base64.getEncoder().encodeToString(bytes);
        return v.toString();
    }
}
