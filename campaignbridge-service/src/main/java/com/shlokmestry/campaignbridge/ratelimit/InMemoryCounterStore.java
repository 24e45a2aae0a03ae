package com.shlokmestry.campaignbridge.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

// Single-node counter store. Writes sweep out expired keys at most once per SWEEP_INTERVAL_MS.
@Repository
@ConditionalOnProperty(name = "campaignbridge.store.type", havingValue = "memory")
public class InMemoryCounterStore implements CounterStore {

    static final long SWEEP_INTERVAL_MS = 1_000L;

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong nextSweepMs = new AtomicLong();
    private final Clock clock;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public OptionalLong get(String key) {
        Entry e = entries.get(key);
        if (e == null) return OptionalLong.empty();
        if (e.expired(clock.millis())) {
            entries.remove(key, e);
            return OptionalLong.empty();
        }
        return OptionalLong.of(e.value());
    }

    @Override
    public void set(String key, long value, Duration ttl) {
        long now = clock.millis();
        sweepIfDue(now);
        entries.put(key, new Entry(value, now + ttl.toMillis()));
    }

    @Override
    public OptionalLong incrementIfBelow(String key, long max, Duration ttl) {
        sweepIfDue(clock.millis());

        long[] result = {-1L};
        entries.compute(key, (k, e) -> {
            long now = clock.millis();
            long current = (e == null || e.expired(now)) ? 0L : e.value();
            if (current >= max) {
                return e;
            }
            result[0] = current + 1;
            return new Entry(current + 1, now + ttl.toMillis());
        });
        return result[0] < 0 ? OptionalLong.empty() : OptionalLong.of(result[0]);
    }

    int size() {
        return entries.size();
    }

    private void sweepIfDue(long now) {
        long due = nextSweepMs.get();
        if (now < due || !nextSweepMs.compareAndSet(due, now + SWEEP_INTERVAL_MS)) return;
        entries.values().removeIf(e -> e.expired(now));
    }

    private record Entry(long value, long expiresAtMs) {
        boolean expired(long nowMs) {
            return nowMs >= expiresAtMs;
        }
    }
}
