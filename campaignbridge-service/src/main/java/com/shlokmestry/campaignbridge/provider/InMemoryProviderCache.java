package com.shlokmestry.campaignbridge.provider;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "campaignbridge.store.type", havingValue = "memory")
public class InMemoryProviderCache implements ProviderCache {

    static final long SWEEP_INTERVAL_MS = 60_000L;

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong nextSweepMs = new AtomicLong();
    private final Clock clock;

    public InMemoryProviderCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry e = entries.get(key);
        if (e == null) return Optional.empty();
        if (e.expired(clock.millis())) {
            entries.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e.json());
    }

    @Override
    public void put(String key, String json, Duration ttl) {
        long now = clock.millis();
        sweepIfDue(now);
        entries.put(key, new Entry(json, now + ttl.toMillis()));
    }

    int size() {
        return entries.size();
    }

    private void sweepIfDue(long now) {
        long due = nextSweepMs.get();
        if (now < due || !nextSweepMs.compareAndSet(due, now + SWEEP_INTERVAL_MS)) return;
        entries.values().removeIf(e -> e.expired(now));
    }

    private record Entry(String json, long expiresAtMs) {
        boolean expired(long nowMs) {
            return nowMs >= expiresAtMs;
        }
    }
}
