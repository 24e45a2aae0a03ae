package com.shlokmestry.campaignbridge.settings;

public interface SettingsStore {
    PluginSettings load();
    void save(PluginSettings settings);
}
