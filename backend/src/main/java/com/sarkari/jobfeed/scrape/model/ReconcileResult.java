package com.sarkari.jobfeed.scrape.model;

import java.util.List;

public record ReconcileResult(
    ReconcileOutcome outcome,
    Long jobId,
    List<String> changedFields
) {
    public static ReconcileResult skipped(Long jobId) {
        return new ReconcileResult(ReconcileOutcome.SKIPPED, jobId, List.of());
    }
}
