package com.shlokmestry.campaignbridge.ratelimit;

import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

// Unset per-action fields inherit the shared value.
@ConfigurationProperties(prefix = "campaignbridge.rate-limit")
public record RateLimitProperties(
        Integer maxRequests,
        Integer windowSeconds,
        String cachePrefix,
        Map<String, ActionLimit> actions
) {

    public RateLimitProperties {
        if (maxRequests == null) maxRequests = RateLimitPolicy.DEFAULT_MAX_REQUESTS;
        if (windowSeconds == null) windowSeconds = RateLimitPolicy.DEFAULT_WINDOW_SECONDS;
        if (cachePrefix == null) cachePrefix = RateLimitPolicy.CACHE_KEY_PREFIX_GENERAL;
        actions = actions == null ? Map.of() : Map.copyOf(actions);
    }

    public RateLimitPolicy policyFor(String action) {
        ActionLimit o = actions.get(action);
        if (o == null) {
            return new RateLimitPolicy(maxRequests, windowSeconds, cachePrefix);
        }
        return new RateLimitPolicy(
                o.maxRequests() != null ? o.maxRequests() : maxRequests,
                o.windowSeconds() != null ? o.windowSeconds() : windowSeconds,
                o.cachePrefix() != null ? o.cachePrefix() : cachePrefix
        );
    }

    public record ActionLimit(
            Integer maxRequests,
            Integer windowSeconds,
            String cachePrefix
    ) {}
}
