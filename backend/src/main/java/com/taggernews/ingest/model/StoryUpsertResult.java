package com.taggernews.ingest.model;

public record StoryUpsertResult(
    StoryRecord story,
    boolean created
) {
}
