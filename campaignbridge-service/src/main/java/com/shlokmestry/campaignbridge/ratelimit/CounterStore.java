package com.shlokmestry.campaignbridge.ratelimit;

import java.time.Duration;
import java.util.OptionalLong;

public interface CounterStore {

    OptionalLong get(String key);

    void set(String key, long value, Duration ttl);

    // New count, or empty at max. Read-then-write, not atomic; shared stores override it.
    default OptionalLong incrementIfBelow(String key, long max, Duration ttl) {
        long current = get(key).orElse(0L);
        if (current >= max) {
            return OptionalLong.empty();
        }
        set(key, current + 1, ttl);
        return OptionalLong.of(current + 1);
    }
}
