package com.taggernews.ingest.model;

import java.time.Instant;

public record ProgressRecord(
    JobName jobName,
    Long cursorValue,
    RunStatus status,
    boolean completed,
    String configKey,
    Instant startedAt,
    Instant lastRunAt,
    Instant lastSuccessAt,
    int failureCount,
    String lastError,
    long itemsProcessed,
    long storiesFound
) {
}
