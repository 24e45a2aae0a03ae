package com.shlokmestry.campaignbridge.api;

import java.util.Map;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record HtmlExportRequest(
        @Size(max = 200) String subject,
        @NotEmpty Map<String, String> sections   // section key -> HTML, rendered in request order
) {}
