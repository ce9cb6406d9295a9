package com.taggernews.ingest.service;

import com.taggernews.config.IngestionProperties;
import com.taggernews.ingest.model.ContentItem;
import com.taggernews.ingest.model.FetchOutcome;
import com.taggernews.ingest.model.ItemResult;
import com.taggernews.ingest.model.JobName;
import com.taggernews.ingest.model.JobRunSummary;
import com.taggernews.ingest.model.ProgressRecord;
import com.taggernews.ingest.model.StoryRecord;
import com.taggernews.ingest.persistence.StoryJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Walks backward through history in bounded batches until the day horizon or id 0 is reached.
 */
@Component
public class BackfillJob implements ScheduledJob {
    private static final Logger log = LoggerFactory.getLogger(BackfillJob.class);

    private final ProgressStore progressStore;
    private final StoryIngestor ingestor;
    private final EnrichmentStage enrichmentStage;
    private final StoryJdbcRepository storyRepository;
    private final IngestionProperties properties;
    private final Clock clock;

    public BackfillJob(
        ProgressStore progressStore,
        StoryIngestor ingestor,
        EnrichmentStage enrichmentStage,
        StoryJdbcRepository storyRepository,
        IngestionProperties properties,
        Clock clock
    ) {
        this.progressStore = progressStore;
        this.ingestor = ingestor;
        this.enrichmentStage = enrichmentStage;
        this.storyRepository = storyRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public JobName name() {
        return JobName.BACKFILL;
    }

    @Override
    public Duration interval() {
        return properties.getBackfill().getInterval();
    }

    /**
     * Fingerprint of the settings the stored cursor belongs to. A change re-opens the backfill.
     */
    String configKey() {
        IngestionProperties.Backfill config = properties.getBackfill();
        Long startId = config.getStartId();
        return "horizon=" + config.getHorizonDays() + ";start=" + (startId == null ? "auto" : startId);
    }

    @Override
    public JobRunSummary run() {
        IngestionProperties.Backfill config = properties.getBackfill();
        String configKey = configKey();
        ProgressRecord progress = progressStore.find(name()).orElse(null);
        if (progress == null || !Objects.equals(progress.configKey(), configKey)) {
            if (progress != null && progress.configKey() != null) {
                log.info("Backfill configuration changed from {} to {}; restarting", progress.configKey(), configKey);
            }
            progressStore.reconfigure(name(), configKey);
            progress = progressStore.find(name()).orElse(null);
        }
        if (progress != null && progress.completed()) {
            log.debug("Backfill already completed for {}", configKey);
            return JobRunSummary.skipped(name(), "completed");
        }

        long cursor = progressStore.getCursor(name())
            .orElseGet(() -> progressStore.initializeCursor(name(), initialCursor(config)));
        Instant horizon = clock.instant().minus(Duration.ofDays(config.getHorizonDays()));
        int batchSize = config.getBatchSize();
        int maxBatches = config.getMaxBatches();

        RunCounters counters = new RunCounters();
        long lowestResolved = cursor;
        boolean reachedHorizon = false;
        boolean interrupted = false;
        int batches = 0;

        while (batches < maxBatches && lowestResolved > 1 && !reachedHorizon && !interrupted) {
            List<StoryRecord> pending = new ArrayList<>();
            int inBatch = 0;
            while (inBatch < batchSize && lowestResolved > 1) {
                long id = lowestResolved - 1;
                FetchOutcome outcome = ingestor.fetch(id);
                if (!outcome.isResolved()) {
                    interrupted = true;
                    break;
                }
                if (outcome.type() == FetchOutcome.Type.FOUND && isBeforeHorizon(outcome.item(), horizon)) {
                    reachedHorizon = true;
                    break;
                }
                ItemResult result = ingestor.resolve(outcome, name());
                counters.count(result);
                if (result.needsEnrichment()) {
                    pending.add(result.stored().story());
                }
                lowestResolved = id;
                inBatch++;
                if (!ingestor.pause(config.getItemDelayMs())) {
                    interrupted = true;
                    break;
                }
            }
            if (!pending.isEmpty()) {
                counters.addEnrichment(enrichmentStage.enrich(pending));
            }
            progressStore.advanceCursor(name(), lowestResolved);
            batches++;
        }

        boolean completed = reachedHorizon || lowestResolved <= 1;
        if (completed) {
            progressStore.markCompleted(name());
        }
        log.info(
            "Backfill processed {} ids in {} batch(es) ({} -> {}), stored {} stories ({} new), ledgered {}{}",
            counters.scanned,
            batches,
            cursor,
            lowestResolved,
            counters.stored,
            counters.created,
            counters.ledgered,
            completed ? (reachedHorizon ? "; reached the " + config.getHorizonDays() + " day horizon" : "; reached id 0") : ""
        );
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cursorBefore", cursor);
        details.put("cursorAfter", lowestResolved);
        details.put("batches", batches);
        details.put("created", counters.created);
        details.put("skipped", counters.skipped);
        details.put("ledgered", counters.ledgered);
        details.put("enriched", counters.enrichment.enriched());
        details.put("completed", completed);
        details.put("interrupted", interrupted);
        return new JobRunSummary(name(), counters.scanned, counters.stored, details);
    }

    long initialCursor(IngestionProperties.Backfill config) {
        if (config.getStartId() != null) {
            return Math.max(1, config.getStartId() + 1);
        }
        return storyRepository.findMinExternalId().orElseGet(() -> ingestor.maxItemId() + 1);
    }

    private boolean isBeforeHorizon(ContentItem item, Instant horizon) {
        return item.time() != null && Instant.ofEpochSecond(item.time()).isBefore(horizon);
    }
}
