package com.shlokmestry.campaignbridge.ratelimit;

public record RateLimitDecision(
        Outcome outcome,
        long retryAfterSeconds,
        long remaining
) {

    public enum Outcome {
        ALLOWED,
        DENIED,
        NO_IDENTITY
    }

    private static final RateLimitDecision NO_IDENTITY = new RateLimitDecision(Outcome.NO_IDENTITY, 0L, 0L);

    public static RateLimitDecision allowed(long remaining) {
        return new RateLimitDecision(Outcome.ALLOWED, 0L, Math.max(0L, remaining));
    }

    public static RateLimitDecision denied(long retryAfterSeconds) {
        return new RateLimitDecision(Outcome.DENIED, Math.max(0L, retryAfterSeconds), 0L);
    }

    public static RateLimitDecision noIdentity() {
        return NO_IDENTITY;
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOWED;
    }
}
