package com.shlokmestry.campaignbridge.identity;

import org.springframework.stereotype.Component;

import jakarta.servlet.http.HttpServletRequest;

@Component
public class RequestIdentityResolver {

    private final IdentityProperties properties;
    private final ClientIpResolver ipResolver;

    public RequestIdentityResolver(IdentityProperties properties, ClientIpResolver ipResolver) {
        this.properties = properties;
        this.ipResolver = ipResolver;
    }

    public RequestIdentity resolve(HttpServletRequest request) {
        // The user header is asserted by the fronting auth layer; from any other peer it is ignored.
        Long userId = properties.trusts(request.getRemoteAddr())
                ? userId(request.getHeader(properties.userHeader()))
                : null;
        return new RequestIdentity(userId, ipResolver.resolve(request));
    }

    // Anything that is not a positive integer counts as "no user".
    private static Long userId(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            long id = Long.parseLong(raw.trim());
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
