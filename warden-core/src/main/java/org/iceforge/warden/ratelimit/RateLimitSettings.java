package org.iceforge.warden.ratelimit;

import java.time.Duration;

public record RateLimitSettings(boolean enabled, int requestsPerWindow, Duration window, String keyPrefix) {

    public static final int DEFAULT_REQUESTS_PER_WINDOW = 100;
    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);

    public RateLimitSettings {
        if (requestsPerWindow <= 0) requestsPerWindow = DEFAULT_REQUESTS_PER_WINDOW;
        if (window == null || window.isZero() || window.isNegative()) window = DEFAULT_WINDOW;
        keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    public static RateLimitSettings defaults() {
        return new RateLimitSettings(true, DEFAULT_REQUESTS_PER_WINDOW, DEFAULT_WINDOW, "warden:");
    }
}
