package com.shlokmestry.campaignbridge.provider;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.shlokmestry.campaignbridge.settings.PluginSettings;

public sealed interface EmailProvider permits MailchimpProvider, HtmlProvider {

    ProviderKind kind();

    default String slug() {
        return kind().slug();
    }

    default String label() {
        return kind().label();
    }

    boolean isConfigured(PluginSettings settings);

    Set<Capability> capabilities();

    List<String> sectionKeys(PluginSettings settings, boolean refresh);

    default Map<String, String> redact(PluginSettings settings) {
        return SecretMasker.redact(settings.toMap());
    }
}
