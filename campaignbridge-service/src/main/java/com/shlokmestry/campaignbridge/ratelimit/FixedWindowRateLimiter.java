package com.shlokmestry.campaignbridge.ratelimit;

import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.shlokmestry.campaignbridge.identity.RequestIdentity;
import com.shlokmestry.campaignbridge.observability.RateLimitMetrics;

// Allowed calls restart the key's TTL; denied calls write nothing.
@Service
public class FixedWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

    private final CounterStore store;
    private final RateLimitMetrics metrics;

    public FixedWindowRateLimiter(CounterStore store, RateLimitMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    public RateLimitDecision check(String action, String identity, RateLimitPolicy policy) {
        RateLimitKey key = new RateLimitKey(policy.cachePrefix(), action, identity);

        final OptionalLong count;
        try {
            count = store.incrementIfBelow(key.asString(), policy.maxRequests(), policy.window());
        } catch (RuntimeException e) {
            metrics.failClosed("store_error");
            log.warn("Fail-closed: counter store error for action={}, identity={}", action, identity, e);
            return record(action, RateLimitDecision.denied(policy.windowSeconds()));
        }

        if (count.isEmpty()) {
            log.debug("ratelimit denied action={} identity={} max={} window={}s",
                    action, identity, policy.maxRequests(), policy.windowSeconds());
            return record(action, RateLimitDecision.denied(policy.windowSeconds()));
        }

        log.debug("ratelimit allowed action={} identity={} count={}/{}",
                action, identity, count.getAsLong(), policy.maxRequests());
        return record(action, RateLimitDecision.allowed(policy.maxRequests() - count.getAsLong()));
    }

    public RateLimitDecision checkBestEffort(String action, RequestIdentity identity, RateLimitPolicy policy) {
        return check(action, identity.bestEffortKey(), policy);
    }

    public RateLimitDecision checkAuthenticated(String action, RequestIdentity identity, RateLimitPolicy policy) {
        return identity.userKey()
                .map(user -> check(action, user, policy))
                .orElseGet(() -> record(action, RateLimitDecision.noIdentity()));
    }

    private RateLimitDecision record(String action, RateLimitDecision decision) {
        metrics.decision(action, decision.outcome());
        return decision;
    }
}
