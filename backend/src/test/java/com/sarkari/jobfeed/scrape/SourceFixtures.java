package com.sarkari.jobfeed.scrape;

import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.model.PaginationConfig;
import com.sarkari.jobfeed.scrape.model.SelectorMap;
import com.sarkari.jobfeed.scrape.model.SourceConfig;
import com.sarkari.jobfeed.scrape.model.SourceStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class SourceFixtures {
    private SourceFixtures() {
    }

    public static SourceConfig source(long id, String baseUrl) {
        return source(id, baseUrl, ".job", PaginationConfig.none(), null);
    }

    public static SourceConfig source(
        long id,
        String baseUrl,
        String containerSelector,
        PaginationConfig pagination,
        FetchStrategyType scraperType
    ) {
        return new SourceConfig(
            id,
            "source-" + id,
            "Source " + id,
            baseUrl,
            new SelectorMap(Map.of(SelectorMap.JOB_CONTAINER, List.of(containerSelector))),
            pagination,
            false,
            false,
            scraperType,
            24,
            null,
            null,
            null,
            false,
            List.of(),
            true,
            null,
            true,
            SourceStatus.ACTIVE,
            null
        );
    }

    public static SourceConfig schedulable(boolean active, SourceStatus status, int frequencyHours, Instant lastScrapedAt) {
        return new SourceConfig(
            7L, "ssc", "Staff Selection Commission", "https://ssc.gov.in",
            null, null, false, false, null, frequencyHours, null, null, null, false, List.of(), true, null,
            active, status, lastScrapedAt
        );
    }

    public static SourceConfig withFlags(boolean requiresJs, boolean complexStructure, FetchStrategyType scraperType) {
        return new SourceConfig(
            9L, "upsc", "Union Public Service Commission", "https://upsc.gov.in",
            null, null, requiresJs, complexStructure, scraperType, 24, null, null, null, false, List.of(), true, null,
            true, SourceStatus.ACTIVE, null
        );
    }
}
