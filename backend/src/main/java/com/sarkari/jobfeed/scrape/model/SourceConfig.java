package com.sarkari.jobfeed.scrape.model;

import java.time.Instant;
import java.util.List;

public record SourceConfig(
    long id,
    String name,
    String displayName,
    String baseUrl,
    SelectorMap selectors,
    PaginationConfig pagination,
    boolean requiresJs,
    boolean complexStructure,
    FetchStrategyType scraperType,
    int frequencyHours,
    Integer requestsPerMinute,
    Integer maxRetries,
    Integer timeoutSeconds,
    boolean useProxy,
    List<String> userAgents,
    boolean blockResources,
    String waitForSelector,
    boolean active,
    SourceStatus status,
    Instant lastScrapedAt
) {
    public SourceConfig {
        userAgents = userAgents == null ? List.of() : List.copyOf(userAgents);
        selectors = selectors == null ? new SelectorMap(null) : selectors;
        pagination = pagination == null ? PaginationConfig.none() : pagination;
        status = status == null ? SourceStatus.ACTIVE : status;
    }

    public String label() {
        return displayName == null || displayName.isBlank() ? name : displayName;
    }

    public SourceConfig withLastScrapedAt(Instant value) {
        return new SourceConfig(
            id, name, displayName, baseUrl, selectors, pagination, requiresJs, complexStructure, scraperType,
            frequencyHours, requestsPerMinute, maxRetries, timeoutSeconds, useProxy, userAgents, blockResources,
            waitForSelector, active, status, value
        );
    }
}
