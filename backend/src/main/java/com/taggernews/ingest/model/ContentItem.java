package com.taggernews.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw item as returned by the content source. Only {@code story} items are persisted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentItem(
    @JsonProperty("id") long id,
    @JsonProperty("type") String type,
    @JsonProperty("title") String title,
    @JsonProperty("url") String url,
    @JsonProperty("score") Integer score,
    @JsonProperty("by") String author,
    @JsonProperty("descendants") Integer commentCount,
    @JsonProperty("time") Long time,
    @JsonProperty("deleted") boolean deleted,
    @JsonProperty("dead") boolean dead
) {
    public boolean isStory() {
        return "story".equals(type);
    }
}
