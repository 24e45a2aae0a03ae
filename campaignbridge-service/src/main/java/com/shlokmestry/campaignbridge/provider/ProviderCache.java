package com.shlokmestry.campaignbridge.provider;

import java.time.Duration;
import java.util.Optional;

public interface ProviderCache {
    Optional<String> get(String key);
    void put(String key, String json, Duration ttl);
}
