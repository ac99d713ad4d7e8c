package com.sarkari.jobfeed.scrape.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field name to an ordered chain of CSS selectors; the first selector that yields a value wins.
 */
public record SelectorMap(Map<String, List<String>> selectors) {
    public static final String JOB_CONTAINER = "job_container";

    public SelectorMap {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (selectors != null) {
            selectors.forEach((field, chain) -> {
                if (field != null && chain != null && !chain.isEmpty()) {
                    copy.put(field, List.copyOf(chain));
                }
            });
        }
        selectors = Map.copyOf(copy);
    }

    public List<String> chain(String field) {
        return selectors.getOrDefault(field, List.of());
    }

    public List<String> containerChain() {
        return chain(JOB_CONTAINER);
    }

    public boolean hasContainer() {
        return !containerChain().isEmpty();
    }
}
