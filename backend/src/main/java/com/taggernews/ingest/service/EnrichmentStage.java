package com.taggernews.ingest.service;

import com.taggernews.config.IngestionProperties;
import com.taggernews.ingest.http.EnrichmentClient;
import com.taggernews.ingest.model.EnrichmentResult;
import com.taggernews.ingest.model.StoryEnrichment;
import com.taggernews.ingest.model.StoryRecord;
import com.taggernews.ingest.model.StoryStatus;
import com.taggernews.ingest.model.TagCandidate;
import com.taggernews.ingest.persistence.StoryJdbcRepository;
import com.taggernews.ingest.persistence.TagJdbcRepository;
import com.taggernews.ingest.taxonomy.TagTaxonomy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sends stories to the enrichment service in batches and persists the outcome per story.
 * Failures become story status; nothing is thrown to the calling job.
 */
@Service
public class EnrichmentStage {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentStage.class);
    static final String MISSING_FROM_RESPONSE = "missing_from_enrichment_response";

    private final EnrichmentClient enrichmentClient;
    private final StoryJdbcRepository storyRepository;
    private final TagJdbcRepository tagRepository;
    private final OperationTimingLog timingLog;
    private final IngestionProperties properties;
    private final Clock clock;

    public EnrichmentStage(
        EnrichmentClient enrichmentClient,
        StoryJdbcRepository storyRepository,
        TagJdbcRepository tagRepository,
        OperationTimingLog timingLog,
        IngestionProperties properties,
        Clock clock
    ) {
        this.enrichmentClient = enrichmentClient;
        this.storyRepository = storyRepository;
        this.tagRepository = tagRepository;
        this.timingLog = timingLog;
        this.properties = properties;
        this.clock = clock;
    }

    public EnrichmentResult enrich(List<StoryRecord> stories) {
        if (stories == null || stories.isEmpty()) {
            return EnrichmentResult.empty();
        }
        List<StoryRecord> eligible = stories.stream()
            .filter(story -> story.status() == StoryStatus.PENDING || story.status() == StoryStatus.FAILED_PENDING)
            .collect(Collectors.toList());
        if (!properties.getEnrichment().isEnabled()) {
            log.debug("Enrichment disabled; {} stories stay {}", eligible.size(), StoryStatus.PENDING.dbValue());
            return new EnrichmentResult(eligible.size(), 0, 0, 0);
        }
        int batchSize = Math.max(1, properties.getEnrichment().getBatchSize());
        EnrichmentResult total = EnrichmentResult.empty();
        for (int start = 0; start < eligible.size(); start += batchSize) {
            List<StoryRecord> batch = eligible.subList(start, Math.min(eligible.size(), start + batchSize));
            total = total.plus(enrichBatch(batch));
        }
        return total;
    }

    private EnrichmentResult enrichBatch(List<StoryRecord> batch) {
        Instant startedAt = clock.instant();
        List<StoryEnrichment> results;
        try {
            results = enrichmentClient.enrich(batch);
        } catch (RuntimeException e) {
            log.warn("Enrichment call failed for batch of {} stories", batch.size(), e);
            timingLog.record("enrichment_batch", Duration.between(startedAt, clock.instant()), batch.size(), false);
            int exhausted = 0;
            for (StoryRecord story : batch) {
                if (markFailed(story, e.getMessage())) {
                    exhausted++;
                }
            }
            return new EnrichmentResult(batch.size(), 0, batch.size(), exhausted);
        }
        timingLog.record("enrichment_batch", Duration.between(startedAt, clock.instant()), batch.size(), true);

        Map<Long, StoryEnrichment> byExternalId = results.stream()
            .collect(Collectors.toMap(StoryEnrichment::externalId, Function.identity(), (first, second) -> first));
        int enriched = 0;
        int failed = 0;
        int exhausted = 0;
        for (StoryRecord story : batch) {
            StoryEnrichment enrichment = byExternalId.get(story.externalId());
            String error = MISSING_FROM_RESPONSE;
            if (enrichment != null) {
                try {
                    persistWithRetry(story, enrichment);
                    enriched++;
                    continue;
                } catch (RuntimeException e) {
                    log.warn("Failed to store enrichment for story {}", story.externalId(), e);
                    error = "store_failed: " + e.getMessage();
                }
            }
            failed++;
            if (markFailed(story, error)) {
                exhausted++;
            }
        }
        log.debug("Enriched {}/{} stories in batch", enriched, batch.size());
        return new EnrichmentResult(batch.size(), enriched, failed, exhausted);
    }

    /**
     * A tag resolved here can be merged or retired by the taxonomy agent before the story links are
     * written. Resolving the tags again once covers that without costing the story an attempt.
     */
    private void persistWithRetry(StoryRecord story, StoryEnrichment enrichment) {
        try {
            persist(story, enrichment);
        } catch (DataIntegrityViolationException e) {
            log.debug("Tags changed while storing story {}; resolving them again", story.externalId(), e);
            persist(story, enrichment);
        }
    }

    private void persist(StoryRecord story, StoryEnrichment enrichment) {
        Set<Long> tagIds = new LinkedHashSet<>();
        for (TagCandidate candidate : enrichment.tagCandidates()) {
            String name = TagTaxonomy.canonicalName(candidate.name()).orElse(candidate.name().trim());
            if (TagTaxonomy.slugify(name).isEmpty()) {
                continue;
            }
            int level = TagTaxonomy.resolveLevel(name, candidate.level());
            String category = TagTaxonomy.categoryOf(name).orElse(null);
            tagIds.add(tagRepository.getOrCreate(name, level, category).id());
        }
        StoryStatus status = storyRepository.applyEnrichment(
            story.id(),
            enrichment.summary(),
            enrichmentClient.modelName(),
            new ArrayList<>(tagIds)
        );
        log.debug("Story {} is now {}", story.externalId(), status.dbValue());
    }

    /**
     * @return true when the story just used up its last attempt
     */
    private boolean markFailed(StoryRecord story, String error) {
        int maxAttempts = properties.getRecovery().getMaxAttempts();
        Optional<StoryStatus> status;
        try {
            status = storyRepository.markEnrichmentFailed(story.id(), error, maxAttempts);
        } catch (RuntimeException e) {
            log.warn("Failed to record enrichment failure for story {}", story.externalId(), e);
            return false;
        }
        if (status.isPresent() && status.get() == StoryStatus.FAILED) {
            log.warn("Story {} failed enrichment {} times; giving up", story.externalId(), maxAttempts);
            return true;
        }
        return false;
    }
}
