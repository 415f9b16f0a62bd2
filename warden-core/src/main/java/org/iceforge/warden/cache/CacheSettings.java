package org.iceforge.warden.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * TTLs per tier plus the namespace prefix for every key this process writes.
 *
 * <p>Defaults assume schema changes less often than permissions, and permissions less often than data. Lower the
 * permission TTL where revocations must take effect quickly: a revoked grant stays usable until its entry expires
 * unless the permission tier is invalidated explicitly.
 */
public record CacheSettings(String keyPrefix, Duration queryTtl, Duration permissionTtl, Duration schemaTtl) {

    public static final Duration DEFAULT_QUERY_TTL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_PERMISSION_TTL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_SCHEMA_TTL = Duration.ofHours(1);

    public CacheSettings {
        keyPrefix = keyPrefix == null ? "" : keyPrefix;
        queryTtl = positiveOr(queryTtl, DEFAULT_QUERY_TTL);
        permissionTtl = positiveOr(permissionTtl, DEFAULT_PERMISSION_TTL);
        schemaTtl = positiveOr(schemaTtl, DEFAULT_SCHEMA_TTL);
    }

    public static CacheSettings defaults() {
        return new CacheSettings("warden:", DEFAULT_QUERY_TTL, DEFAULT_PERMISSION_TTL, DEFAULT_SCHEMA_TTL);
    }

    public Duration ttl(CacheTier tier) {
        Objects.requireNonNull(tier, "tier");
        return switch (tier) {
            case QUERY -> queryTtl;
            case PERMISSION -> permissionTtl;
            case SCHEMA -> schemaTtl;
        };
    }

    /** True when schema TTL >= permission TTL >= query TTL. */
    public boolean volatilityOrdered() {
        return schemaTtl.compareTo(permissionTtl) >= 0 && permissionTtl.compareTo(queryTtl) >= 0;
    }

    private static Duration positiveOr(Duration d, Duration fallback) {
        return (d == null || d.isNegative() || d.isZero()) ? fallback : d;
    }
}
