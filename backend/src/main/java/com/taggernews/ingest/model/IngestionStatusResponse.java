package com.taggernews.ingest.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record IngestionStatusResponse(
    Instant generatedAt,
    List<ProgressRecord> jobs,
    Map<String, Long> storiesByStatus,
    Long sourceMaxId,
    Long continuousGap,
    long openFetchFailures,
    long pendingProposals
) {
}
