package com.taggernews.ingest.model;

import java.time.Instant;

public record FetchFailureRecord(
    long externalId,
    JobName jobName,
    String reason,
    int attemptCount,
    Instant firstFailedAt,
    Instant lastFailedAt,
    boolean abandoned
) {
}
