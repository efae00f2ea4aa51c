package com.example.messenger.widget;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Locale;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class ClientIpResolver {

    static final String UNKNOWN = "unknown";

    public String resolve(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        String ip = firstFromList(request.getHeader("X-Forwarded-For"));
        if (ip == null) {
            ip = normalize(request.getHeader("X-Real-IP"));
        }
        if (ip == null) {
            ip = fromForwarded(request.getHeader("Forwarded"));
        }
        if (ip == null) {
            ip = normalize(request.getRemoteAddr());
        }
        return ip != null ? ip : UNKNOWN;
    }

    private String firstFromList(String header) {
        if (!StringUtils.hasText(header)) {
            return null;
        }
        for (String part : header.split(",")) {
            String ip = normalize(part);
            if (ip != null) {
                return ip;
            }
        }
        return null;
    }

    private String fromForwarded(String header) {
        if (!StringUtils.hasText(header)) {
            return null;
        }
        for (String entry : header.split(",")) {
            for (String pair : entry.split(";")) {
                String candidate = pair.trim();
                if (!candidate.toLowerCase(Locale.ROOT).startsWith("for=")) {
                    continue;
                }
                String raw = candidate.substring(4).trim();
                if (raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"")) {
                    raw = raw.substring(1, raw.length() - 1);
                }
                if (raw.startsWith("[") && raw.indexOf(']') > 0) {
                    raw = raw.substring(1, raw.indexOf(']'));
                }
                String ip = normalize(raw);
                if (ip != null) {
                    return ip;
                }
            }
        }
        return null;
    }

    private String normalize(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        String ip = raw.trim();
        if (UNKNOWN.equalsIgnoreCase(ip)) {
            return null;
        }
        // IPv4 with port
        int colon = ip.indexOf(':');
        if (colon > 0 && ip.indexOf(':', colon + 1) < 0 && ip.chars().filter(ch -> ch == '.').count() == 3) {
            ip = ip.substring(0, colon);
        }
        return ip;
    }
}
