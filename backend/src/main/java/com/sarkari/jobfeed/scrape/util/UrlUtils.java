package com.sarkari.jobfeed.scrape.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {
    }

    /**
     * Best-effort cleanup of a scraped link: trims, adds {@code https://} when the scheme is
     * missing and rejects anything that is not an absolute http(s) URL with a host.
     */
    public static String normalizeHttpUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String trimmed = candidate.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:") || lower.startsWith("mailto:") || lower.startsWith("#")) {
            return null;
        }
        if (trimmed.startsWith("//")) {
            trimmed = "https:" + trimmed;
        } else if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            if (lower.contains("://")) {
                return null;
            }
            trimmed = "https://" + trimmed;
        }
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return trimmed;
    }

    public static boolean isHttpUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        URI uri = safeUri(candidate.trim());
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return false;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return scheme.equals("http") || scheme.equals("https");
    }

    public static String host(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static URI safeUri(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new URI(value.trim().replace(" ", "%20"));
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
