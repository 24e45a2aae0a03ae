package com.shlokmestry.campaignbridge.settings;

import java.util.List;
import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "campaignbridge.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisSettingsStore implements SettingsStore {

    static final String KEY = "campaignbridge_settings";

    private final StringRedisTemplate redis;

    public RedisSettingsStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public PluginSettings load() {
        Map<Object, Object> m = redis.opsForHash().entries(KEY);
        if (m == null || m.isEmpty()) return PluginSettings.empty();
        return PluginSettings.fromMap(m);
    }

    @Override
    public void save(PluginSettings settings) {
        Map<String, String> fields = settings.toMap();

        // Replace the whole hash so cleared fields do not linger; MULTI/EXEC hides the empty gap from readers.
        redis.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.delete(KEY);
                ops.opsForHash().putAll(KEY, fields);
                return ops.exec();
            }
        });
    }
}
