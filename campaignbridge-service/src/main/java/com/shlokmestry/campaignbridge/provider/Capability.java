package com.shlokmestry.campaignbridge.provider;

public enum Capability {
    AUDIENCES,
    TEMPLATES,
    SCHEDULING,
    AUTOMATION,
    ANALYTICS,
    EXPORT,
    PREVIEW
}
