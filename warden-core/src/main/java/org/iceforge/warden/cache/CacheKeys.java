package org.iceforge.warden.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Key derivation for each tier. Keys never embed raw SQL or parameter values; the query tier uses a SHA-256 over a
 * canonical rendering of its inputs.
 */
public final class CacheKeys {
    private CacheKeys() {
    }

    /**
     * @param rowLimit effective row ceiling; results capped at different limits must not share an entry
     */
    public static String query(String rewrittenSql, List<?> bindParameters, String userId, int rowLimit) {
        Objects.requireNonNull(rewrittenSql, "rewrittenSql");
        Objects.requireNonNull(userId, "userId");
        StringBuilder sb = new StringBuilder(rewrittenSql.length() + 128);
        sb.append("user=").append(escape(userId)).append('\n');
        sb.append("sql=").append(rewrittenSql).append('\n');
        sb.append("params=").append(canonicalize(bindParameters)).append('\n');
        sb.append("rowLimit=").append(rowLimit).append('\n');
        return sha256Hex(sb.toString());
    }

    public static String permission(String userId, String schema, String table) {
        return permissionPrefix(userId) + schema.toLowerCase(Locale.ROOT) + "." + table.toLowerCase(Locale.ROOT);
    }

    /** Prefix covering every permission entry of one user. */
    public static String permissionPrefix(String userId) {
        return escape(userId) + ":";
    }

    public static String schema(String schema, String table) {
        return schema.toLowerCase(Locale.ROOT) + "." + table.toLowerCase(Locale.ROOT);
    }

    private static String canonicalize(List<?> params) {
        if (params == null || params.isEmpty()) return "[]";
        StringBuilder sb = new StringBuilder("[");
        boolean first = true;
        for (Object v : params) {
            if (!first) sb.append(',');
            first = false;
            sb.append(canonicalizeValue(v));
        }
        return sb.append(']').toString();
    }

    private static String canonicalizeValue(Object v) {
        if (v == null) return "null";
        if (v instanceof CharSequence s) return '"' + escape(s.toString()) + '"';
        if (v instanceof Boolean b) return b ? "true" : "false";
        // type tag keeps 1 (int) and 1.0 (double) apart
        if (v instanceof Number n) return v.getClass().getSimpleName() + ":" + n;
        if (v instanceof Date d) return "date:" + d.toInstant();
        return v.getClass().getSimpleName() + ":\"" + escape(v.toString()) + '"';
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace(":", "\\:")
                .replace("\"", "\\\"");
    }

    static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
