package com.shlokmestry.campaignbridge.identity;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "campaignbridge.identity")
public record IdentityProperties(
        String userHeader,
        List<String> trustedProxies
) {

    public static final String DEFAULT_USER_HEADER = "X-CampaignBridge-User";

    public IdentityProperties {
        if (userHeader == null || userHeader.isBlank()) userHeader = DEFAULT_USER_HEADER;
        trustedProxies = trustedProxies == null ? List.of() : List.copyOf(trustedProxies);
    }

    public boolean trusts(String peer) {
        return trustedProxies.contains("*") || (peer != null && trustedProxies.contains(peer));
    }
}
