package com.taggernews.ingest.model;

public record EnrichmentResult(
    int requested,
    int enriched,
    int failed,
    int exhausted
) {
    public static EnrichmentResult empty() {
        return new EnrichmentResult(0, 0, 0, 0);
    }

    public EnrichmentResult plus(EnrichmentResult other) {
        return new EnrichmentResult(
            requested + other.requested,
            enriched + other.enriched,
            failed + other.failed,
            exhausted + other.exhausted
        );
    }
}
