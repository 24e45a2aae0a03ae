package com.shlokmestry.campaignbridge.provider;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class SecretMasker {

    static final Set<String> SENSITIVE_FIELDS = Set.of("api_key", "secret", "password", "token");
    private static final char BULLET = '•';

    private SecretMasker() {}

    // Keeps the last four characters of values longer than eight.
    public static String mask(String value) {
        if (value == null || value.isEmpty()) return "";
        if (value.length() <= 8) return String.valueOf(BULLET).repeat(value.length());
        return String.valueOf(BULLET).repeat(value.length() - 4) + value.substring(value.length() - 4);
    }

    public static Map<String, String> redact(Map<String, String> settings) {
        Map<String, String> out = new LinkedHashMap<>(settings);
        for (String field : SENSITIVE_FIELDS) {
            String v = out.get(field);
            if (v != null && !v.isEmpty()) {
                out.put(field, mask(v));
            }
        }
        return out;
    }
}
