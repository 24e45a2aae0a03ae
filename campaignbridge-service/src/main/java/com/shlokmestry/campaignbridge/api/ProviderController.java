package com.shlokmestry.campaignbridge.api;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.campaignbridge.provider.EmailProvider;
import com.shlokmestry.campaignbridge.provider.HtmlProvider;
import com.shlokmestry.campaignbridge.provider.ProviderRegistry;
import com.shlokmestry.campaignbridge.settings.PluginSettings;
import com.shlokmestry.campaignbridge.settings.SettingsStore;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1")
public class ProviderController {

    private final RateLimitGuard guard;
    private final ProviderRegistry providers;
    private final HtmlProvider html;
    private final SettingsStore settings;

    public ProviderController(RateLimitGuard guard, ProviderRegistry providers, HtmlProvider html, SettingsStore settings) {
        this.guard = guard;
        this.providers = providers;
        this.html = html;
        this.settings = settings;
    }

    @GetMapping("/providers")
    public ItemsResponse<ProviderResponse> list(HttpServletRequest request) {
        guard.requireAuthenticated("providers", request);

        PluginSettings s = settings.load();
        List<ProviderResponse> items = providers.all().stream()
                .map(p -> toResponse(p, s))
                .collect(Collectors.toList());
        return new ItemsResponse<>(items);
    }

    @PostMapping("/export/html")
    public ResponseEntity<String> exportHtml(@Valid @RequestBody HtmlExportRequest req, HttpServletRequest request) {
        guard.requireAuthenticated("html_export", request);

        String subject = req.subject() != null ? req.subject() : settings.load().subject();
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_HTML)
                .body(html.export(subject, req.sections()));
    }

    private static ProviderResponse toResponse(EmailProvider p, PluginSettings s) {
        return new ProviderResponse(
                p.slug(),
                p.label(),
                p.isConfigured(s),
                p.slug().equals(s.provider()),
                p.capabilities().stream().map(c -> c.name().toLowerCase()).sorted().collect(Collectors.toList())
        );
    }
}
