package com.taggernews.ingest.model;

public record ItemResult(
    FetchOutcome outcome,
    StoryUpsertResult stored
) {
    public boolean isStored() {
        return stored != null;
    }

    public boolean needsEnrichment() {
        return stored != null && stored.story().status() == StoryStatus.PENDING;
    }
}
