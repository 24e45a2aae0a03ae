package com.shlokmestry.campaignbridge.ratelimit;

import java.time.Duration;
import java.util.Objects;

public record RateLimitPolicy(
        int maxRequests,
        int windowSeconds,
        String cachePrefix
) {

    public static final int DEFAULT_MAX_REQUESTS = 30;
    public static final int DEFAULT_WINDOW_SECONDS = 60;
    public static final String CACHE_KEY_PREFIX_GENERAL = "campaignbridge_rate_limit_";
    public static final String CACHE_KEY_PREFIX_EDITOR = "campaignbridge_rate_limit_editor_settings_";

    public RateLimitPolicy {
        if (maxRequests < 1) throw new IllegalArgumentException("maxRequests < 1");
        if (windowSeconds < 1) throw new IllegalArgumentException("windowSeconds < 1");
        Objects.requireNonNull(cachePrefix, "cachePrefix");
    }

    public static RateLimitPolicy defaults() {
        return new RateLimitPolicy(DEFAULT_MAX_REQUESTS, DEFAULT_WINDOW_SECONDS, CACHE_KEY_PREFIX_GENERAL);
    }

    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }
}
