package com.sarkari.jobfeed.scrape.model;

import java.util.Locale;

public enum SourceStatus {
    ACTIVE,
    PAUSED,
    ERROR,
    MAINTENANCE;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SourceStatus fromDbValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACTIVE;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ERROR;
        }
    }
}
