package com.shlokmestry.campaignbridge.settings;

import java.util.concurrent.atomic.AtomicReference;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "campaignbridge.store.type", havingValue = "memory")
public class InMemorySettingsStore implements SettingsStore {

    private final AtomicReference<PluginSettings> current = new AtomicReference<>(PluginSettings.empty());

    @Override
    public PluginSettings load() {
        return current.get();
    }

    @Override
    public void save(PluginSettings settings) {
        current.set(settings);
    }
}
