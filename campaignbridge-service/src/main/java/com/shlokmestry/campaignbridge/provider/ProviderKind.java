package com.shlokmestry.campaignbridge.provider;

import java.util.Arrays;
import java.util.Optional;

public enum ProviderKind {
    MAILCHIMP("mailchimp", "Mailchimp"),
    HTML("html", "HTML Export");

    private final String slug;
    private final String label;

    ProviderKind(String slug, String label) {
        this.slug = slug;
        this.label = label;
    }

    public String slug() {
        return slug;
    }

    public String label() {
        return label;
    }

    public static Optional<ProviderKind> fromSlug(String slug) {
        return Arrays.stream(values())
                .filter(k -> k.slug.equals(slug))
                .findFirst();
    }
}
