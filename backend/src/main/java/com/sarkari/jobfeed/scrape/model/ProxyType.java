package com.sarkari.jobfeed.scrape.model;

import java.util.Locale;

public enum ProxyType {
    HTTP,
    HTTPS,
    SOCKS4,
    SOCKS5;

    public boolean isSocks() {
        return this == SOCKS4 || this == SOCKS5;
    }

    public static ProxyType fromDbValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return HTTP;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return HTTP;
        }
    }
}
