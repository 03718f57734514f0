package com.recoveryos.utils;

import com.recoveryos.security.ratelimit.ClientKeyStrategy;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Salted hash of the normalized source address and user agent. The last IPv4
 * octet and version numbers in the agent string are dropped first.
 * <p>
 * The address is the socket peer from {@link HttpServletRequest#getRemoteAddr()}.
 * Forwarding headers are caller-controlled and are not read here; behind a
 * trusted proxy the container resolves the client address before this runs
 * ({@code server.forward-headers-strategy: native}).
 */
public class DefaultClientKey implements ClientKeyStrategy {

    private static final Pattern IPV4_PREFIX = Pattern.compile("^(\\d+\\.\\d+\\.\\d+)\\.\\d+$");

    private final String salt;

    public DefaultClientKey(String salt) {
        this.salt = salt;
    }

    @Override
    public String generate(HttpServletRequest request) {
        String ip = normalizeIp(request == null ? null : request.getRemoteAddr());
        String ua = normalizeUa(request == null ? null : request.getHeader("User-Agent"));
        return Hashing.salted(salt, String.join("|", ip, ua));
    }

    static String normalizeIp(String ip) {
        if (ip == null) return "0";

        if (ip.contains(".")) { // IPv4
            var m = IPV4_PREFIX.matcher(ip);
            if (m.matches()) return m.group(1) + ".0";
            return ip;
        }

        if (ip.contains(":")) { // IPv6
            return ip.split(":")[0] + "::";
        }

        return ip;
    }

    static String normalizeUa(String ua) {
        if (ua == null) return "ua-null";
        return ua.toLowerCase(Locale.ROOT)
                .replaceAll("\\d+(\\.\\d+)*", "")
                .replaceAll("\\s+", " ");
    }
}
