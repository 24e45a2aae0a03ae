package com.shlokmestry.campaignbridge.api;

import jakarta.validation.constraints.Size;

public record VerifyKeyRequest(
        @Size(max = 50) String apiKey   // optional; falls back to the stored key
) {}
