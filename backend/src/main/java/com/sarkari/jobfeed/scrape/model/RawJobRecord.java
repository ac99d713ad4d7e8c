package com.sarkari.jobfeed.scrape.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RawJobRecord(
    Map<String, String> fields,
    String pageUrl,
    String sourceUrl,
    Long scrapeRunId
) {
    public RawJobRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String field(String name) {
        String value = fields.get(name);
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * True when the container carried its own link rather than inheriting the listing page URL.
     */
    public boolean hasOwnLink() {
        return sourceUrl != null && !sourceUrl.equals(pageUrl);
    }

    public boolean has(String name) {
        return field(name) != null;
    }
}
