package com.taggernews.ingest.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary and tags returned by the enrichment service for one story, keyed by external id.
 */
public record StoryEnrichment(
    long externalId,
    String summary,
    List<String> level1Tags,
    List<String> level2Tags,
    List<String> level3Tags
) {
    public StoryEnrichment {
        level1Tags = level1Tags == null ? List.of() : List.copyOf(level1Tags);
        level2Tags = level2Tags == null ? List.of() : List.copyOf(level2Tags);
        level3Tags = level3Tags == null ? List.of() : List.copyOf(level3Tags);
    }

    public List<TagCandidate> tagCandidates() {
        List<TagCandidate> out = new ArrayList<>();
        level1Tags.forEach(name -> out.add(new TagCandidate(name, 1)));
        level2Tags.forEach(name -> out.add(new TagCandidate(name, 2)));
        level3Tags.forEach(name -> out.add(new TagCandidate(name, 3)));
        return out;
    }
}
