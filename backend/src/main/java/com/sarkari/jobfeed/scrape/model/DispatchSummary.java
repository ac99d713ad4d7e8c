package com.sarkari.jobfeed.scrape.model;

import java.util.List;

public record DispatchSummary(
    int sourcesEvaluated,
    List<Long> dispatchedSourceIds,
    List<Long> scrapeRunIds
) {
}
