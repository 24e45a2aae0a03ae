package com.shlokmestry.campaignbridge.observability;

import org.springframework.stereotype.Component;

import com.shlokmestry.campaignbridge.ratelimit.RateLimitDecision;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

@Component
public class RateLimitMetrics {

    private final MeterRegistry registry;

    public RateLimitMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void decision(String action, RateLimitDecision.Outcome outcome) {
        Counter.builder("ratelimit.decisions.total")
                .description("Total rate-limit decisions by outcome")
                .tag("action", action)
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void failClosed(String reason) {
        Counter.builder("ratelimit.fail_closed.total")
                .description("Requests denied because the counter store failed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
