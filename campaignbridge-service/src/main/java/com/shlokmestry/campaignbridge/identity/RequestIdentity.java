package com.shlokmestry.campaignbridge.identity;

import java.util.Optional;

public record RequestIdentity(
        Long userId,
        String clientIp
) {

    public static final String LOOPBACK = "127.0.0.1";

    public RequestIdentity {
        if (userId != null && userId <= 0) userId = null;
        if (clientIp == null || clientIp.isBlank()) clientIp = LOOPBACK;
    }

    public static RequestIdentity anonymous(String clientIp) {
        return new RequestIdentity(null, clientIp);
    }

    public static RequestIdentity user(long userId, String clientIp) {
        return new RequestIdentity(userId, clientIp);
    }

    public boolean authenticated() {
        return userId != null;
    }

    public Optional<String> userKey() {
        return authenticated() ? Optional.of("user_" + userId) : Optional.empty();
    }

    public String bestEffortKey() {
        return userKey().orElse("ip_" + clientIp);
    }
}
