package com.taggernews.ingest.service;

import com.taggernews.config.IngestionProperties;
import com.taggernews.ingest.model.FetchOutcome;
import com.taggernews.ingest.model.ItemResult;
import com.taggernews.ingest.model.JobName;
import com.taggernews.ingest.model.JobRunSummary;
import com.taggernews.ingest.model.StoryRecord;
import com.taggernews.ingest.model.StoryStatus;
import com.taggernews.ingest.model.StoryUpsertResult;
import com.taggernews.ingest.persistence.StoryJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks forward from the cursor towards the source's newest id, then refreshes the current top stories.
 */
@Component
public class ContinuousSyncJob implements ScheduledJob {
    private static final Logger log = LoggerFactory.getLogger(ContinuousSyncJob.class);

    private final ProgressStore progressStore;
    private final StoryIngestor ingestor;
    private final EnrichmentStage enrichmentStage;
    private final StoryJdbcRepository storyRepository;
    private final IngestionProperties properties;

    public ContinuousSyncJob(
        ProgressStore progressStore,
        StoryIngestor ingestor,
        EnrichmentStage enrichmentStage,
        StoryJdbcRepository storyRepository,
        IngestionProperties properties
    ) {
        this.progressStore = progressStore;
        this.ingestor = ingestor;
        this.enrichmentStage = enrichmentStage;
        this.storyRepository = storyRepository;
        this.properties = properties;
    }

    @Override
    public JobName name() {
        return JobName.CONTINUOUS_SYNC;
    }

    @Override
    public Duration interval() {
        return properties.getContinuous().getInterval();
    }

    @Override
    public JobRunSummary run() {
        IngestionProperties.Continuous config = properties.getContinuous();
        int batchSize = config.getBatchSize();
        long maxId = ingestor.maxItemId();
        long cursor = progressStore.getCursor(name())
            .orElseGet(() -> progressStore.initializeCursor(name(), initialCursor(maxId, batchSize)));
        long upper = Math.min(maxId, cursor + batchSize);

        RunCounters counters = new RunCounters();
        List<StoryRecord> pending = new ArrayList<>();
        long highestResolved = cursor;
        boolean interrupted = false;
        int chunkSize = Math.max(1, properties.getEnrichment().getBatchSize());

        for (long id = cursor + 1; id <= upper; id++) {
            ItemResult result = ingestor.ingest(id, name());
            if (!result.outcome().isResolved()) {
                interrupted = true;
                break;
            }
            counters.count(result);
            highestResolved = id;
            if (result.needsEnrichment()) {
                pending.add(result.stored().story());
            }
            if (pending.size() >= chunkSize) {
                commit(pending, highestResolved, counters);
                pending = new ArrayList<>();
            }
            if (id < upper && !ingestor.pause(config.getItemDelayMs())) {
                interrupted = true;
                break;
            }
        }
        commit(pending, highestResolved, counters);

        int refreshed = 0;
        if (!interrupted && config.getTopStoriesRefreshLimit() > 0) {
            refreshed = refreshTopStories(config.getTopStoriesRefreshLimit(), counters);
        }

        long cursorAfter = progressStore.getCursor(name()).orElse(cursor);
        log.info(
            "Continuous sync scanned {} ids ({} -> {}, source max {}), stored {} stories ({} new), ledgered {}, refreshed {}",
            counters.scanned,
            cursor,
            cursorAfter,
            maxId,
            counters.stored,
            counters.created,
            counters.ledgered,
            refreshed
        );
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cursorBefore", cursor);
        details.put("cursorAfter", cursorAfter);
        details.put("sourceMaxId", maxId);
        details.put("created", counters.created);
        details.put("skipped", counters.skipped);
        details.put("ledgered", counters.ledgered);
        details.put("enriched", counters.enrichment.enriched());
        details.put("enrichmentFailed", counters.enrichment.failed());
        details.put("topStoriesRefreshed", refreshed);
        details.put("interrupted", interrupted);
        return new JobRunSummary(name(), counters.scanned, counters.stored, details);
    }

    long initialCursor(long maxId, int batchSize) {
        Long configured = properties.getContinuous().getStartCursor();
        if (configured != null) {
            return Math.max(0, configured);
        }
        return storyRepository.findMaxExternalId().orElse(Math.max(maxId - batchSize, 0));
    }

    private void commit(List<StoryRecord> pending, long highestResolved, RunCounters counters) {
        if (!pending.isEmpty()) {
            counters.addEnrichment(enrichmentStage.enrich(pending));
        }
        progressStore.advanceCursor(name(), highestResolved);
    }

    private int refreshTopStories(int limit, RunCounters counters) {
        List<Long> ids;
        try {
            ids = ingestor.topStoryIds(limit);
        } catch (RuntimeException e) {
            log.warn("Top story refresh skipped; could not load the top list", e);
            return 0;
        }
        List<StoryRecord> pending = new ArrayList<>();
        int refreshed = 0;
        for (Long id : ids) {
            FetchOutcome outcome = ingestor.fetch(id);
            if (!outcome.isResolved()) {
                break;
            }
            if (outcome.type() != FetchOutcome.Type.FOUND || !outcome.item().isStory()) {
                continue;
            }
            Optional<StoryUpsertResult> stored = ingestor.tryStore(outcome.item());
            if (stored.isPresent()) {
                refreshed++;
                if (stored.get().story().status() == StoryStatus.PENDING) {
                    pending.add(stored.get().story());
                }
            }
            if (!ingestor.pause(properties.getContinuous().getItemDelayMs())) {
                break;
            }
        }
        if (!pending.isEmpty()) {
            counters.addEnrichment(enrichmentStage.enrich(pending));
        }
        return refreshed;
    }
}
