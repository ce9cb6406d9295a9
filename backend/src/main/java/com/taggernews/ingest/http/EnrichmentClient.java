package com.taggernews.ingest.http;

import com.taggernews.ingest.error.EnrichmentCallException;
import com.taggernews.ingest.model.StoryEnrichment;
import com.taggernews.ingest.model.StoryRecord;

import java.util.List;

/**
 * Summarization and tagging service. A call covers a whole batch and fails as a unit.
 */
public interface EnrichmentClient {

    /**
     * Results are keyed by {@link StoryEnrichment#externalId()}; stories the service skipped are simply absent.
     */
    List<StoryEnrichment> enrich(List<StoryRecord> stories) throws EnrichmentCallException;

    String modelName();
}
