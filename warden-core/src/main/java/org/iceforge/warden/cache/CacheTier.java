package org.iceforge.warden.cache;

import java.util.Locale;

/** Independently expiring namespaces inside one cache store. */
public enum CacheTier {
    QUERY,
    SCHEMA,
    PERMISSION;

    public String keyPrefix() {
        return name().toLowerCase(Locale.ROOT) + ":";
    }
}
