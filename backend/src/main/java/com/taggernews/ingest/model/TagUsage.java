package com.taggernews.ingest.model;

public record TagUsage(
    long tagId,
    String name,
    String slug,
    int level,
    String category,
    long usageCount
) {
}
