package com.shlokmestry.campaignbridge.api;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.campaignbridge.ratelimit.RateLimitDecision;
import com.shlokmestry.campaignbridge.ratelimit.RateLimitPolicy;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1")
public class EnforceController {

    private final RateLimitGuard guard;

    public EnforceController(RateLimitGuard guard) {
        this.guard = guard;
    }

    @PostMapping("/enforce")
    public ResponseEntity<Void> enforce(@Valid @RequestBody CheckRateLimitRequest req, HttpServletRequest request) {
        RateLimitDecision decision = guard.require(req.action(), request, req.userRequired());
        RateLimitPolicy policy = guard.policyFor(req.action());

        HttpHeaders h = new HttpHeaders();
        h.set("RateLimit-Limit", String.valueOf(policy.maxRequests()));
        h.set("RateLimit-Remaining", String.valueOf(decision.remaining()));
        // Every allowed call restarts the window.
        h.set("RateLimit-Reset", String.valueOf(policy.windowSeconds()));
        return ResponseEntity.noContent().headers(h).build();
    }
}
