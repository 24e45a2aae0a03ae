package com.shlokmestry.campaignbridge.api;

public class RateLimitExceededException extends RuntimeException {

    private final String action;
    private final int limit;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String action, int limit, long retryAfterSeconds) {
        super(String.format("Rate limit exceeded. Try again in %d seconds.", retryAfterSeconds));
        this.action = action;
        this.limit = limit;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String action() {
        return action;
    }

    public int limit() {
        return limit;
    }

    public long retryAfterSeconds() {
        return retryAfterSeconds;
    }
}
