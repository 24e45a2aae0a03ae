package com.shlokmestry.campaignbridge.api;

import java.util.List;

public record ProviderResponse(
        String slug,
        String label,
        boolean configured,
        boolean active,
        List<String> capabilities
) {}
