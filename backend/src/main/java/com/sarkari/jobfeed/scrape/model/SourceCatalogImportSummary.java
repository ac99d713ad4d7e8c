package com.sarkari.jobfeed.scrape.model;

import java.util.List;

public record SourceCatalogImportSummary(
    int rowsRead,
    int sourcesInserted,
    int sourcesUpdated,
    List<String> errors
) {
}
