package com.shlokmestry.campaignbridge.provider;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "campaignbridge.mailchimp")
public record MailchimpProperties(
        String baseUrlTemplate,
        Duration cacheTtl,
        Duration timeout
) {

    public static final String DEFAULT_BASE_URL_TEMPLATE = "https://%s.api.mailchimp.com/3.0";

    public MailchimpProperties {
        if (baseUrlTemplate == null || baseUrlTemplate.isBlank()) baseUrlTemplate = DEFAULT_BASE_URL_TEMPLATE;
        if (cacheTtl == null) cacheTtl = Duration.ofMinutes(15);
        if (timeout == null) timeout = Duration.ofSeconds(20);
    }

    public static MailchimpProperties defaults() {
        return new MailchimpProperties(null, null, null);
    }

    public String baseUrl(String dataCenter) {
        return String.format(baseUrlTemplate, dataCenter);
    }
}
