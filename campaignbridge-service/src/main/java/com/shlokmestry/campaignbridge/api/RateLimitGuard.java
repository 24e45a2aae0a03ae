package com.shlokmestry.campaignbridge.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.shlokmestry.campaignbridge.identity.RequestIdentity;
import com.shlokmestry.campaignbridge.identity.RequestIdentityResolver;
import com.shlokmestry.campaignbridge.ratelimit.FixedWindowRateLimiter;
import com.shlokmestry.campaignbridge.ratelimit.RateLimitDecision;
import com.shlokmestry.campaignbridge.ratelimit.RateLimitPolicy;
import com.shlokmestry.campaignbridge.ratelimit.RateLimitProperties;

import jakarta.servlet.http.HttpServletRequest;

@Component
public class RateLimitGuard {

    private static final Logger log = LoggerFactory.getLogger(RateLimitGuard.class);

    private final FixedWindowRateLimiter limiter;
    private final RateLimitProperties properties;
    private final RequestIdentityResolver identities;

    public RateLimitGuard(FixedWindowRateLimiter limiter, RateLimitProperties properties, RequestIdentityResolver identities) {
        this.limiter = limiter;
        this.properties = properties;
        this.identities = identities;
    }

    public RequestIdentity requireAuthenticated(String action, HttpServletRequest request) {
        RequestIdentity identity = identities.resolve(request);
        enforce(action, identity, true);
        return identity;
    }

    // Like requireAuthenticated, but for either mode and handing back the decision for quota headers.
    public RateLimitDecision require(String action, HttpServletRequest request, boolean requireUser) {
        return enforce(action, identities.resolve(request), requireUser);
    }

    // Non-throwing variant for callers that branch on the outcome.
    public RateLimitDecision evaluate(String action, HttpServletRequest request, boolean requireUser) {
        return decide(action, identities.resolve(request), properties.policyFor(action), requireUser);
    }

    public RateLimitPolicy policyFor(String action) {
        return properties.policyFor(action);
    }

    private RateLimitDecision enforce(String action, RequestIdentity identity, boolean requireUser) {
        RateLimitPolicy policy = properties.policyFor(action);
        RateLimitDecision decision = decide(action, identity, policy, requireUser);

        switch (decision.outcome()) {
            case ALLOWED:
                return decision;
            case NO_IDENTITY:
                log.info("ratelimit reject reason=no_user action={} ip={}", action, identity.clientIp());
                throw new NotAuthenticatedException(action);
            default:
                log.info("ratelimit reject reason=rate_limited action={} identity={} retryAfter={}s",
                        action, identity.bestEffortKey(), decision.retryAfterSeconds());
                throw new RateLimitExceededException(action, policy.maxRequests(), decision.retryAfterSeconds());
        }
    }

    private RateLimitDecision decide(String action, RequestIdentity identity, RateLimitPolicy policy, boolean requireUser) {
        return requireUser
                ? limiter.checkAuthenticated(action, identity, policy)
                : limiter.checkBestEffort(action, identity, policy);
    }
}
