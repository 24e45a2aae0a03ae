package com.shlokmestry.campaignbridge.identity;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import jakarta.servlet.http.HttpServletRequest;

// Forwarding headers count only when the connecting peer is a trusted proxy.
@Component
public class ClientIpResolver {

    static final List<String> FORWARDING_HEADERS = List.of(
            "CF-Connecting-IP",
            "Client-IP",
            "X-Forwarded-For",
            "X-Forwarded",
            "X-Cluster-Client-IP",
            "Forwarded-For",
            "Forwarded"
    );

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-fA-F:.]+$");

    private final IdentityProperties properties;

    public ClientIpResolver(IdentityProperties properties) {
        this.properties = properties;
    }

    public String resolve(HttpServletRequest request) {
        String peer = request.getRemoteAddr();

        if (properties.trusts(peer)) {
            for (String header : FORWARDING_HEADERS) {
                String raw = request.getHeader(header);
                if (raw == null || raw.isBlank()) continue;

                String candidate = raw.trim();
                int comma = candidate.indexOf(',');
                if (comma >= 0) {
                    candidate = candidate.substring(0, comma).trim();
                }
                if (isPublicIp(candidate)) {
                    return candidate;
                }
            }
        }

        return (peer == null || peer.isBlank()) ? RequestIdentity.LOOPBACK : peer.trim();
    }

// IP literal outside private, loopback, link-local and other reserved ranges.
    static boolean isPublicIp(String value) {
        InetAddress addr = parseLiteral(value);
        if (addr == null) return false;

        if (addr.isAnyLocalAddress() || addr.isLoopbackAddress() || addr.isLinkLocalAddress()
                || addr.isSiteLocalAddress() || addr.isMulticastAddress()) {
            return false;
        }

        byte[] b = addr.getAddress();
        if (b.length == 4) {
            int first = b[0] & 0xff;
            int second = b[1] & 0xff;
            // 0/8, 240/4 reserved; 172.16/12 and 192.168/16 are caught by isSiteLocal
            return first != 0 && first < 240 && !(first == 100 && second >= 64 && second < 128);
        }
        // fc00::/7 unique-local
        return (b[0] & 0xfe) != 0xfc;
    }

    private static InetAddress parseLiteral(String value) {
        if (value == null || value.isEmpty()) return null;

        Matcher m = IPV4.matcher(value);
        if (m.matches()) {
            for (int i = 1; i <= 4; i++) {
                if (Integer.parseInt(m.group(i)) > 255) return null;
            }
        } else if (!value.contains(":") || !IPV6_CHARS.matcher(value).matches()) {
            return null;
        }

        // Only literals reach this point, so no name lookup happens.
        try {
            return InetAddress.getByName(value);
        } catch (UnknownHostException e) {
            return null;
        }
    }
}
