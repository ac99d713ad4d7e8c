package com.sarkari.jobfeed.scrape.model;

import java.util.Locale;

public enum ScrapeErrorType {
    NETWORK,
    PARSING,
    VALIDATION,
    TIMEOUT,
    JAVASCRIPT,
    RATE_LIMIT,
    OTHER;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScrapeErrorType fromDbValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
