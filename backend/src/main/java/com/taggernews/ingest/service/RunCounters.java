package com.taggernews.ingest.service;

import com.taggernews.ingest.model.EnrichmentResult;
import com.taggernews.ingest.model.ItemResult;

/**
 * Per-run tallies for the scraping jobs.
 */
final class RunCounters {
    long scanned;
    long stored;
    long created;
    long skipped;
    long ledgered;
    EnrichmentResult enrichment = EnrichmentResult.empty();

    void count(ItemResult result) {
        scanned++;
        if (result.isStored()) {
            stored++;
            if (result.stored().created()) {
                created++;
            }
            return;
        }
        switch (result.outcome().type()) {
            case PERMANENT_FAILURE -> skipped++;
            case TRANSIENT_EXHAUSTED -> ledgered++;
            default -> {
            }
        }
    }

    void addEnrichment(EnrichmentResult result) {
        enrichment = enrichment.plus(result);
    }
}
