package com.shlokmestry.campaignbridge.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdateSettingsRequest(
        @NotBlank String provider,
        @Size(max = 50) String apiKey,      // blank keeps the stored key
        @Size(max = 100) String audienceId,
        @Min(1) Long templateId,
        @Size(max = 200) String fromName,
        @Email String fromEmail,
        @Size(max = 200) String subject,
        @Size(max = 200) String preheader
) {}
