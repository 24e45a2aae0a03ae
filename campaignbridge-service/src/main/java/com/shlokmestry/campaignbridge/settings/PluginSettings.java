package com.shlokmestry.campaignbridge.settings;

import java.util.LinkedHashMap;
import java.util.Map;

public record PluginSettings(
        String provider,
        String apiKey,
        String audienceId,
        Long templateId,
        String fromName,
        String fromEmail,
        String subject,
        String preheader
) {

    public static final String DEFAULT_PROVIDER = "mailchimp";

    public PluginSettings {
        if (provider == null || provider.isBlank()) provider = DEFAULT_PROVIDER;
    }

    public static PluginSettings empty() {
        return new PluginSettings(DEFAULT_PROVIDER, null, null, null, null, null, null, null);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public PluginSettings withApiKey(String key) {
        return new PluginSettings(provider, key, audienceId, templateId, fromName, fromEmail, subject, preheader);
    }

    // Null values are left out.
    public Map<String, String> toMap() {
        Map<String, String> m = new LinkedHashMap<>();
        put(m, "provider", provider);
        put(m, "api_key", apiKey);
        put(m, "audience_id", audienceId);
        put(m, "template_id", templateId == null ? null : String.valueOf(templateId));
        put(m, "from_name", fromName);
        put(m, "from_email", fromEmail);
        put(m, "subject", subject);
        put(m, "preheader", preheader);
        return m;
    }

    public static PluginSettings fromMap(Map<?, ?> m) {
        String templateId = (String) m.get("template_id");
        return new PluginSettings(
                (String) m.get("provider"),
                (String) m.get("api_key"),
                (String) m.get("audience_id"),
                templateId == null || templateId.isBlank() ? null : Long.valueOf(templateId),
                (String) m.get("from_name"),
                (String) m.get("from_email"),
                (String) m.get("subject"),
                (String) m.get("preheader")
        );
    }

    private static void put(Map<String, String> m, String key, String value) {
        if (value != null) m.put(key, value);
    }
}
