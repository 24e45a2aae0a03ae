package com.shlokmestry.campaignbridge.api;

public record CheckRateLimitResponse(
        String outcome,
        boolean allowed,
        long retryAfterSeconds,
        long remaining
) {}
