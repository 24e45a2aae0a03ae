package com.shlokmestry.campaignbridge.ratelimit;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "campaignbridge.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisCounterStore implements CounterStore {

    private final StringRedisTemplate redis;
    private final RedisScript<Long> script;

    public RedisCounterStore(StringRedisTemplate redis) {
        this.redis = redis;
        this.script = RedisScript.of(new ClassPathResource("lua/fixed_window.lua"), Long.class);
    }

    @Override
    public OptionalLong get(String key) {
        String raw = redis.opsForValue().get(key);
        if (raw == null) return OptionalLong.empty();
        return OptionalLong.of(Long.parseLong(raw));
    }

    @Override
    public void set(String key, long value, Duration ttl) {
        redis.opsForValue().set(key, String.valueOf(value), ttl);
    }

    @Override
    public OptionalLong incrementIfBelow(String key, long max, Duration ttl) {
        Long res = redis.execute(
                script,
                List.of(key),
                String.valueOf(max),
                String.valueOf(ttl.toSeconds())
        );
        if (res == null) {
            throw new IllegalStateException("Empty script response for key " + key);
        }
        return res < 0 ? OptionalLong.empty() : OptionalLong.of(res);
    }
}
