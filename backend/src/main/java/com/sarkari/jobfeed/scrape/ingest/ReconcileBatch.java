package com.sarkari.jobfeed.scrape.ingest;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job ids already matched during one run. A stored posting is matched at most once per run.
 */
public class ReconcileBatch {
    private final Set<Long> claimed = ConcurrentHashMap.newKeySet();

    boolean claim(Long jobId) {
        return jobId != null && claimed.add(jobId);
    }

    public int size() {
        return claimed.size();
    }
}
