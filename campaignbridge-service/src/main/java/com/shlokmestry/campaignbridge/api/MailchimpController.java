package com.shlokmestry.campaignbridge.api;

import java.util.List;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.campaignbridge.provider.MailchimpProvider;
import com.shlokmestry.campaignbridge.provider.ProviderException;
import com.shlokmestry.campaignbridge.provider.ProviderKind;
import com.shlokmestry.campaignbridge.settings.PluginSettings;
import com.shlokmestry.campaignbridge.settings.SettingsStore;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1/mailchimp")
public class MailchimpController {

    private final RateLimitGuard guard;
    private final MailchimpProvider mailchimp;
    private final SettingsStore settings;

    public MailchimpController(RateLimitGuard guard, MailchimpProvider mailchimp, SettingsStore settings) {
        this.guard = guard;
        this.mailchimp = mailchimp;
        this.settings = settings;
    }

    @GetMapping("/sections")
    public Map<String, List<String>> sections(
            @RequestParam(defaultValue = "false") boolean refresh,
            HttpServletRequest request
    ) {
        guard.requireAuthenticated("mc_sections", request);

        PluginSettings s = settings.load();
        if (!ProviderKind.MAILCHIMP.slug().equals(s.provider())) {
            throw ProviderException.badRequest("unsupported", "Only supported for Mailchimp");
        }
        return Map.of("sections", mailchimp.sectionKeys(s, refresh));
    }

    @GetMapping("/audiences")
    public ItemsResponse<MailchimpProvider.Audience> audiences(
            @RequestParam(defaultValue = "false") boolean refresh,
            HttpServletRequest request
    ) {
        guard.requireAuthenticated("mc_audiences", request);
        return new ItemsResponse<>(mailchimp.audiences(settingsWithKey(), refresh));
    }

    @GetMapping("/templates")
    public ItemsResponse<MailchimpProvider.Template> templates(
            @RequestParam(defaultValue = "false") boolean refresh,
            HttpServletRequest request
    ) {
        guard.requireAuthenticated("mc_templates", request);
        return new ItemsResponse<>(mailchimp.templates(settingsWithKey(), refresh));
    }

    @PostMapping("/verify")
    public Map<String, Boolean> verify(
            @Valid @RequestBody(required = false) VerifyKeyRequest req,
            HttpServletRequest request
    ) {
        guard.requireAuthenticated("mc_verify", request);

        PluginSettings s = settings.load();
        if (!ProviderKind.MAILCHIMP.slug().equals(s.provider())) {
            throw ProviderException.badRequest("bad_provider", "Provider is not Mailchimp");
        }
        if (req != null && req.apiKey() != null && !req.apiKey().isBlank()) {
            s = s.withApiKey(req.apiKey().trim());
        }
        if (!s.hasApiKey()) {
            throw ProviderException.badRequest("missing_key", "Missing API key");
        }
        mailchimp.audiences(s, true);
        return Map.of("ok", true);
    }

    private PluginSettings settingsWithKey() {
        PluginSettings s = settings.load();
        if (!s.hasApiKey()) {
            throw ProviderException.badRequest("missing_key", "Missing API key");
        }
        return s;
    }
}
