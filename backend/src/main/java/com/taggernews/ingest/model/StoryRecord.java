package com.taggernews.ingest.model;

import java.time.Instant;

public record StoryRecord(
    long id,
    long externalId,
    String title,
    String url,
    int score,
    String author,
    int commentCount,
    Instant sourceCreatedAt,
    StoryStatus status,
    int attemptCount,
    String lastError,
    Instant statusChangedAt,
    Instant createdAt,
    Instant updatedAt
) {
}
