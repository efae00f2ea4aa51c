package com.example.messenger.widget;

import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Matches the page embedding a widget against the inbox's allowed domains. Entries are plain
 * hostnames or {@code *.example.com}, which covers proper subdomains only. An empty list allows
 * every origin.
 */
@Component
public class OriginAllowlist {

    public boolean isAllowed(Collection<String> allowedDomains, String originHost) {
        List<String> normalized = normalizeEntries(allowedDomains);
        if (normalized.isEmpty()) {
            return true;
        }
        if (!StringUtils.hasText(originHost)) {
            return false;
        }
        String host = originHost.trim().toLowerCase(Locale.ROOT);
        for (String allowed : normalized) {
            if (allowed.startsWith("*.")) {
                String suffix = allowed.substring(1);
                if (host.endsWith(suffix) && !host.equals(suffix.substring(1))) {
                    return true;
                }
            } else if (host.equals(allowed)) {
                return true;
            }
        }
        return false;
    }

    public String resolveOriginHost(HttpServletRequest request) {
        String origin = request.getHeader("Origin");
        String source = StringUtils.hasText(origin) && !"null".equals(origin.trim()) ? origin : request.getHeader("Referer");
        return hostOf(source);
    }

    List<String> normalizeEntries(Collection<String> allowedDomains) {
        if (allowedDomains == null) {
            return List.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (String entry : allowedDomains) {
            String normalized = normalizeEntry(entry);
            if (!normalized.isEmpty()) {
                result.add(normalized);
            }
        }
        return List.copyOf(result);
    }

    static String normalizeEntry(String raw) {
        if (!StringUtils.hasText(raw)) {
            return "";
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.contains("://")) {
            value = hostOf(value);
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }
        int colon = value.indexOf(':');
        if (colon >= 0) {
            value = value.substring(0, colon);
        }
        return value.trim();
    }

    private static String hostOf(String url) {
        if (!StringUtils.hasText(url)) {
            return "";
        }
        try {
            String host = URI.create(url.trim()).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : "";
        } catch (IllegalArgumentException ex) {
            return "";
        }
    }
}
