package com.taggernews.ingest.service;

import com.taggernews.config.IngestionProperties;
import com.taggernews.ingest.model.EnrichmentResult;
import com.taggernews.ingest.model.FetchFailureRecord;
import com.taggernews.ingest.model.FetchOutcome;
import com.taggernews.ingest.model.JobName;
import com.taggernews.ingest.model.JobRunSummary;
import com.taggernews.ingest.model.StoryRecord;
import com.taggernews.ingest.model.StoryStatus;
import com.taggernews.ingest.model.StoryUpsertResult;
import com.taggernews.ingest.persistence.FetchFailureRepository;
import com.taggernews.ingest.persistence.StoryJdbcRepository;
import com.taggernews.ingest.util.FetchErrorClassifier;
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
import java.util.Optional;

/**
 * Retries enrichment of {@code failed_pending} stories and re-fetches ids from the failure ledger.
 * Only persisted state is swept; the live feed is never scanned here.
 */
@Component
public class RecoverySweepJob implements ScheduledJob {
    private static final Logger log = LoggerFactory.getLogger(RecoverySweepJob.class);

    private final StoryJdbcRepository storyRepository;
    private final FetchFailureRepository fetchFailureRepository;
    private final EnrichmentStage enrichmentStage;
    private final StoryIngestor ingestor;
    private final IngestionProperties properties;
    private final Clock clock;

    public RecoverySweepJob(
        StoryJdbcRepository storyRepository,
        FetchFailureRepository fetchFailureRepository,
        EnrichmentStage enrichmentStage,
        StoryIngestor ingestor,
        IngestionProperties properties,
        Clock clock
    ) {
        this.storyRepository = storyRepository;
        this.fetchFailureRepository = fetchFailureRepository;
        this.enrichmentStage = enrichmentStage;
        this.ingestor = ingestor;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public JobName name() {
        return JobName.RECOVERY_SWEEP;
    }

    @Override
    public Duration interval() {
        return properties.getRecovery().getInterval();
    }

    @Override
    public JobRunSummary run() {
        IngestionProperties.Recovery config = properties.getRecovery();
        Instant cutoff = clock.instant().minus(config.getGracePeriod());

        List<StoryRecord> retry = storyRepository.findFailedPendingBefore(cutoff, config.getBatchLimit());
        EnrichmentResult storyResult = enrichmentStage.enrich(retry);

        LedgerCounters ledger = sweepLedger(cutoff, config);

        log.info(
            "Recovery sweep retried {} stories ({} recovered, {} failed again, {} exhausted); ledger: {} retried, {} resolved, {} abandoned",
            retry.size(),
            storyResult.enriched(),
            storyResult.failed(),
            storyResult.exhausted(),
            ledger.retried,
            ledger.resolved,
            ledger.abandoned
        );
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("storiesRetried", retry.size());
        details.put("storiesRecovered", storyResult.enriched());
        details.put("storiesFailedAgain", storyResult.failed());
        details.put("storiesExhausted", storyResult.exhausted());
        details.put("ledgerRetried", ledger.retried);
        details.put("ledgerResolved", ledger.resolved);
        details.put("ledgerAbandoned", ledger.abandoned);
        return new JobRunSummary(name(), retry.size() + ledger.retried, ledger.stored, details);
    }

    private LedgerCounters sweepLedger(Instant cutoff, IngestionProperties.Recovery config) {
        LedgerCounters counters = new LedgerCounters();
        List<FetchFailureRecord> entries = fetchFailureRepository.findRetryable(cutoff, config.getBatchLimit());
        List<StoryRecord> pending = new ArrayList<>();
        for (FetchFailureRecord entry : entries) {
            FetchOutcome outcome = ingestor.fetch(entry.externalId());
            if (!outcome.isResolved()) {
                break;
            }
            counters.retried++;
            if (outcome.type() == FetchOutcome.Type.FOUND && outcome.item().isStory()) {
                Optional<StoryUpsertResult> stored = ingestor.tryStore(outcome.item());
                if (stored.isEmpty()) {
                    recordRetryFailure(entry, FetchErrorClassifier.STORE_FAILED, config, counters);
                    continue;
                }
                counters.stored++;
                if (stored.get().story().status() == StoryStatus.PENDING) {
                    pending.add(stored.get().story());
                }
            }
            switch (outcome.type()) {
                case FOUND, PERMANENT_FAILURE -> {
                    fetchFailureRepository.delete(entry.externalId());
                    counters.resolved++;
                }
                default -> recordRetryFailure(entry, outcome.reason(), config, counters);
            }
        }
        if (!pending.isEmpty()) {
            enrichmentStage.enrich(pending);
        }
        return counters;
    }

    private void recordRetryFailure(
        FetchFailureRecord entry,
        String reason,
        IngestionProperties.Recovery config,
        LedgerCounters counters
    ) {
        int attempts = fetchFailureRepository.recordFailure(entry.externalId(), entry.jobName(), reason);
        if (attempts >= config.getMaxAttempts()) {
            fetchFailureRepository.markAbandoned(entry.externalId());
            counters.abandoned++;
            log.warn("Giving up on item {} after {} failed attempts: {}", entry.externalId(), attempts, reason);
        }
    }

    private static final class LedgerCounters {
        int retried;
        int resolved;
        int abandoned;
        int stored;
    }
}
