package com.taggernews.ingest.model;

import java.time.Instant;

public record TagRecord(
    long id,
    String name,
    String slug,
    int level,
    String category,
    Instant createdAt
) {
}
