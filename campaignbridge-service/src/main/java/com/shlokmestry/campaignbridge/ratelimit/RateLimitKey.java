package com.shlokmestry.campaignbridge.ratelimit;

public record RateLimitKey(
        String cachePrefix,
        String action,
        String identity
) {

    public RateLimitKey {
        if (action == null || action.isEmpty()) throw new IllegalArgumentException("action is empty");
        if (identity == null || identity.isEmpty()) throw new IllegalArgumentException("identity is empty");
        if (cachePrefix == null) cachePrefix = "";
    }

    public String asString() {
        return cachePrefix + action + "_" + identity;
    }
}
