package com.sarkari.jobfeed.scrape.model;

public record PaginationConfig(
    String nextPageSelector,
    String urlPattern,
    int startPage,
    int maxPages
) {
    public static final String PAGE_PLACEHOLDER = "{page}";

    public static PaginationConfig none() {
        return new PaginationConfig(null, null, 1, 1);
    }

    public boolean usesUrlPattern() {
        return urlPattern != null && urlPattern.contains(PAGE_PLACEHOLDER);
    }

    public boolean usesNextPageSelector() {
        return !usesUrlPattern() && nextPageSelector != null && !nextPageSelector.isBlank();
    }

    public String pageUrl(int page) {
        if (!usesUrlPattern()) {
            return null;
        }
        return urlPattern.replace(PAGE_PLACEHOLDER, Integer.toString(page));
    }
}
