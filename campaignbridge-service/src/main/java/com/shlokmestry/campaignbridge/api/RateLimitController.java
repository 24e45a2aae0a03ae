package com.shlokmestry.campaignbridge.api;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.campaignbridge.ratelimit.RateLimitDecision;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1")
public class RateLimitController {

    private final RateLimitGuard guard;

    public RateLimitController(RateLimitGuard guard) {
        this.guard = guard;
    }

    @PostMapping("/check")
    public CheckRateLimitResponse check(@Valid @RequestBody CheckRateLimitRequest req, HttpServletRequest request) {
        RateLimitDecision d = guard.evaluate(req.action(), request, req.userRequired());
        return new CheckRateLimitResponse(d.outcome().name().toLowerCase(), d.isAllowed(), d.retryAfterSeconds(), d.remaining());
    }
}
