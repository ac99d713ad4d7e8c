package com.sarkari.jobfeed.scrape.model;

import java.util.Locale;

public enum FetchStrategyType {
    HTTP,
    BROWSER,
    CRAWL;

    public static FetchStrategyType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "http", "requests" -> HTTP;
            case "browser", "playwright", "selenium" -> BROWSER;
            case "crawl", "scrapy" -> CRAWL;
            default -> null;
        };
    }
}
