package com.shlokmestry.campaignbridge.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

@Component
public class ProviderRegistry {

    private final Map<String, EmailProvider> bySlug = new LinkedHashMap<>();

    public ProviderRegistry(List<EmailProvider> providers) {
        for (EmailProvider p : providers) {
            bySlug.put(p.slug(), p);
        }
    }

    public Optional<EmailProvider> find(String slug) {
        return Optional.ofNullable(bySlug.get(slug));
    }

    public List<EmailProvider> all() {
        return List.copyOf(bySlug.values());
    }
}
