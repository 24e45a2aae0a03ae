package com.shlokmestry.campaignbridge.api;

import jakarta.validation.constraints.NotBlank;

public record CheckRateLimitRequest(
        @NotBlank String action,       // e.g., "posts", "mc_audiences"
        Boolean requireUser            // null/false = fall back to client IP
) {

    public boolean userRequired() {
        return Boolean.TRUE.equals(requireUser);
    }
}
