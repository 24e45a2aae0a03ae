package com.shlokmestry.campaignbridge.api;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.campaignbridge.identity.RequestIdentity;
import com.shlokmestry.campaignbridge.provider.ProviderException;
import com.shlokmestry.campaignbridge.provider.ProviderRegistry;
import com.shlokmestry.campaignbridge.provider.SecretMasker;
import com.shlokmestry.campaignbridge.settings.PluginSettings;
import com.shlokmestry.campaignbridge.settings.SettingsStore;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1/settings")
public class SettingsController {

    private static final Logger log = LoggerFactory.getLogger(SettingsController.class);

    private final RateLimitGuard guard;
    private final SettingsStore store;
    private final ProviderRegistry providers;

    public SettingsController(RateLimitGuard guard, SettingsStore store, ProviderRegistry providers) {
        this.guard = guard;
        this.store = store;
        this.providers = providers;
    }

    @GetMapping
    public Map<String, String> get(HttpServletRequest request) {
        guard.requireAuthenticated("settings", request);
        return redacted(store.load());
    }

    @PutMapping
    public Map<String, String> update(@Valid @RequestBody UpdateSettingsRequest req, HttpServletRequest request) {
        RequestIdentity caller = guard.requireAuthenticated("settings", request);

        if (providers.find(req.provider()).isEmpty()) {
            throw ProviderException.badRequest("bad_provider", "Unknown provider: " + req.provider());
        }

        PluginSettings current = store.load();
        String apiKey = (req.apiKey() == null || req.apiKey().isBlank()) ? current.apiKey() : req.apiKey().trim();

        PluginSettings updated = new PluginSettings(
                req.provider(),
                apiKey,
                req.audienceId(),
                req.templateId(),
                req.fromName(),
                req.fromEmail(),
                req.subject(),
                req.preheader()
        );
        store.save(updated);

        log.info("settings updated by={} provider={}", caller.bestEffortKey(), updated.provider());
        return redacted(updated);
    }

    private Map<String, String> redacted(PluginSettings s) {
        return providers.find(s.provider())
                .map(p -> p.redact(s))
                .orElseGet(() -> SecretMasker.redact(s.toMap()));
    }
}
