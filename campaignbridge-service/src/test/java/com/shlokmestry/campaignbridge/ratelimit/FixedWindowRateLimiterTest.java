package com.shlokmestry.campaignbridge.ratelimit;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.shlokmestry.campaignbridge.identity.RequestIdentity;
import com.shlokmestry.campaignbridge.observability.RateLimitMetrics;
import com.shlokmestry.campaignbridge.ratelimit.RateLimitDecision.Outcome;
import com.shlokmestry.campaignbridge.support.MutableClock;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class FixedWindowRateLimiterTest {

    private static final String PREFIX = RateLimitPolicy.CACHE_KEY_PREFIX_GENERAL;

    private MutableClock clock;
    private RecordingStore store;
    private SimpleMeterRegistry registry;
    private FixedWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        store = new RecordingStore(new InMemoryCounterStore(clock));
        registry = new SimpleMeterRegistry();
        limiter = new FixedWindowRateLimiter(store, new RateLimitMetrics(registry));
    }

    private static RateLimitPolicy policy(int max, int window) {
        return new RateLimitPolicy(max, window, PREFIX);
    }

    @Test
    void allowsUpToMaxThenDenies() {
        RateLimitPolicy p = policy(5, 60);

        for (int i = 1; i <= 5; i++) {
            assertThat(limiter.check("posts", "user_1", p).outcome())
                    .as("request %d", i)
                    .isEqualTo(Outcome.ALLOWED);
            clock.advanceSeconds(1);
        }

        assertThat(limiter.check("posts", "user_1", p).outcome()).isEqualTo(Outcome.DENIED);
    }

    @Test
    void identitiesAreIndependent() {
        RateLimitPolicy p = policy(1, 60);

        assertThat(limiter.check("posts", "user_1", p).isAllowed()).isTrue();
        assertThat(limiter.check("posts", "user_1", p).outcome()).isEqualTo(Outcome.DENIED);

        assertThat(limiter.check("posts", "user_2", p).isAllowed()).isTrue();
    }

    @Test
    void actionsAreIndependent() {
        RateLimitPolicy p = policy(2, 60);

        limiter.check("posts", "user_7", p);
        limiter.check("posts", "user_7", p);
        assertThat(limiter.check("posts", "user_7", p).outcome()).isEqualTo(Outcome.DENIED);

        assertThat(limiter.check("templates", "user_7", p).isAllowed()).isTrue();
    }

    @Test
    void prefixesAreIndependent() {
        limiter.check("posts", "user_7", new RateLimitPolicy(1, 60, PREFIX));

        RateLimitDecision other = limiter.check("posts", "user_7",
                new RateLimitPolicy(1, 60, RateLimitPolicy.CACHE_KEY_PREFIX_EDITOR));

        assertThat(other.isAllowed()).isTrue();
    }

    @Test
    void counterRestartsAfterExpiry() {
        RateLimitPolicy p = policy(2, 60);
        limiter.check("posts", "ip_8.8.8.8", p);
        limiter.check("posts", "ip_8.8.8.8", p);
        assertThat(limiter.check("posts", "ip_8.8.8.8", p).outcome()).isEqualTo(Outcome.DENIED);

        clock.advanceSeconds(61);

        assertThat(limiter.check("posts", "ip_8.8.8.8", p).isAllowed()).isTrue();
        assertThat(store.get(PREFIX + "posts_ip_8.8.8.8")).hasValue(1L);
    }

    @Test
    void everyAllowedCallExtendsTheWindow() {
        RateLimitPolicy p = policy(3, 60);

        limiter.check("sections", "user_3", p);       // t=0, expires t=60
        clock.advanceSeconds(50);
        limiter.check("sections", "user_3", p);       // t=50, expires t=110
        clock.advanceSeconds(50);
        assertThat(limiter.check("sections", "user_3", p).isAllowed())
                .as("t=100: still counting, the first call's window would have ended at 60")
                .isTrue();                            // count=3, expires t=160
        clock.advanceSeconds(50);

        assertThat(limiter.check("sections", "user_3", p).outcome()).isEqualTo(Outcome.DENIED);
        assertThat(store.get(PREFIX + "sections_user_3")).hasValue(3L);
    }

    @Test
    void deniedAlwaysReportsFullWindow() {
        RateLimitPolicy p = policy(1, 45);
        limiter.check("posts", "user_1", p);

        clock.advanceSeconds(30);
        RateLimitDecision d = limiter.check("posts", "user_1", p);

        assertThat(d.outcome()).isEqualTo(Outcome.DENIED);
        assertThat(d.retryAfterSeconds()).isEqualTo(45);
    }

    @Test
    void allowedDecisionCountsDownRemaining() {
        RateLimitPolicy p = policy(3, 60);

        assertThat(limiter.check("posts", "user_9", p).remaining()).isEqualTo(2);
        assertThat(limiter.check("posts", "user_9", p).remaining()).isEqualTo(1);
        assertThat(limiter.check("posts", "user_9", p).remaining()).isZero();
        assertThat(limiter.check("posts", "user_9", p).remaining()).isZero();
    }

    @Test
    void deniedCallDoesNotExtendTheWindow() {
        RateLimitPolicy p = policy(1, 60);
        limiter.check("posts", "user_1", p);                        // expires t=60
        clock.advanceSeconds(59);
        assertThat(limiter.check("posts", "user_1", p).isAllowed()).isFalse();

        clock.advanceSeconds(1);
        assertThat(limiter.check("posts", "user_1", p).isAllowed()).isTrue();
    }

    @Test
    void sectionsScenario() {
        RateLimitPolicy p = policy(3, 60);
        String key = PREFIX + "sections_user_42";

        for (long expected = 1; expected <= 3; expected++) {
            assertThat(limiter.check("sections", "user_42", p).isAllowed()).isTrue();
            assertThat(store.get(key)).hasValue(expected);
            clock.advanceSeconds(5);
        }

        RateLimitDecision fourth = limiter.check("sections", "user_42", p);
        assertThat(fourth.outcome()).isEqualTo(Outcome.DENIED);
        assertThat(fourth.retryAfterSeconds()).isEqualTo(60);

        clock.advanceSeconds(61);

        assertThat(limiter.check("sections", "user_42", p).isAllowed()).isTrue();
        assertThat(store.get(key)).hasValue(1L);
    }

    @Test
    void authenticatedModeWithoutUserNeverTouchesStore() {
        RateLimitDecision d = limiter.checkAuthenticated("editor_settings",
                RequestIdentity.anonymous("8.8.8.8"), policy(30, 60));

        assertThat(d.outcome()).isEqualTo(Outcome.NO_IDENTITY);
        assertThat(store.calls).isZero();
    }

    @Test
    void authenticatedModeBucketsByUser() {
        RateLimitPolicy p = policy(1, 60);

        assertThat(limiter.checkAuthenticated("posts", RequestIdentity.user(9, "1.1.1.1"), p).isAllowed()).isTrue();
        assertThat(limiter.checkAuthenticated("posts", RequestIdentity.user(9, "9.9.9.9"), p).isAllowed())
                .as("same user from a different address shares the bucket")
                .isFalse();
        assertThat(store.get(PREFIX + "posts_user_9")).hasValue(1L);
    }

    @Test
    void bestEffortFallsBackToIp() {
        RateLimitPolicy p = policy(1, 60);

        assertThat(limiter.checkBestEffort("posts", RequestIdentity.anonymous("8.8.4.4"), p).isAllowed()).isTrue();
        assertThat(store.get(PREFIX + "posts_ip_8.8.4.4")).hasValue(1L);

        assertThat(limiter.checkBestEffort("posts", RequestIdentity.anonymous("8.8.4.4"), p).outcome())
                .isEqualTo(Outcome.DENIED);
        assertThat(limiter.checkBestEffort("posts", RequestIdentity.user(5, "8.8.4.4"), p).isAllowed()).isTrue();
    }

    @Test
    void oneStoreRoundTripPerCheck() {
        RateLimitPolicy p = policy(1, 60);

        limiter.check("posts", "user_1", p);
        limiter.check("posts", "user_1", p);

        assertThat(store.calls).isEqualTo(2);
    }

    @Test
    void failsClosedWhenStoreThrows() {
        CounterStore broken = new CounterStore() {
            @Override
            public OptionalLong get(String key) {
                throw new IllegalStateException("down");
            }

            @Override
            public void set(String key, long value, Duration ttl) {
                throw new IllegalStateException("down");
            }
        };
        FixedWindowRateLimiter failing = new FixedWindowRateLimiter(broken, new RateLimitMetrics(registry));

        RateLimitDecision d = failing.check("posts", "user_1", policy(30, 60));

        assertThat(d.outcome()).isEqualTo(Outcome.DENIED);
        assertThat(d.retryAfterSeconds()).isEqualTo(60);
        assertThat(registry.counter("ratelimit.fail_closed.total", "reason", "store_error").count()).isEqualTo(1.0);
    }

    @Test
    void readThenWriteDefaultEnforcesCeiling() {
        MapStore plain = new MapStore();
        FixedWindowRateLimiter l = new FixedWindowRateLimiter(plain, new RateLimitMetrics(registry));
        RateLimitPolicy p = policy(2, 60);

        assertThat(l.check("posts", "user_1", p).isAllowed()).isTrue();
        assertThat(l.check("posts", "user_1", p).isAllowed()).isTrue();
        assertThat(l.check("posts", "user_1", p).isAllowed()).isFalse();
        assertThat(plain.values).containsEntry(PREFIX + "posts_user_1", 2L);
    }

    @Test
    void recordsDecisionMetrics() {
        RateLimitPolicy p = policy(1, 60);
        limiter.check("posts", "user_1", p);
        limiter.check("posts", "user_1", p);

        assertThat(registry.counter("ratelimit.decisions.total", "action", "posts", "outcome", "allowed").count())
                .isEqualTo(1.0);
        assertThat(registry.counter("ratelimit.decisions.total", "action", "posts", "outcome", "denied").count())
                .isEqualTo(1.0);
    }

    /** Counts every store operation the limiter makes. */
    private static final class RecordingStore implements CounterStore {
        private final CounterStore delegate;
        int calls;

        RecordingStore(CounterStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public OptionalLong get(String key) {
            // reads made by the test itself are not counted
            return delegate.get(key);
        }

        @Override
        public void set(String key, long value, Duration ttl) {
            calls++;
            delegate.set(key, value, ttl);
        }

        @Override
        public OptionalLong incrementIfBelow(String key, long max, Duration ttl) {
            calls++;
            return delegate.incrementIfBelow(key, max, ttl);
        }
    }

    /** Only get/set; no expiry. Exercises the interface's read-then-write default. */
    private static final class MapStore implements CounterStore {
        final Map<String, Long> values = new HashMap<>();

        @Override
        public OptionalLong get(String key) {
            Long v = values.get(key);
            return v == null ? OptionalLong.empty() : OptionalLong.of(v);
        }

        @Override
        public void set(String key, long value, Duration ttl) {
            values.put(key, value);
        }
    }
}
