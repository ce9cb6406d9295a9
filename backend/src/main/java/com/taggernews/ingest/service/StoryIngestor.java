package com.taggernews.ingest.service;

import com.taggernews.config.IngestionProperties;
import com.taggernews.ingest.error.PermanentFetchException;
import com.taggernews.ingest.error.TransientFetchException;
import com.taggernews.ingest.http.ContentSource;
import com.taggernews.ingest.model.ContentItem;
import com.taggernews.ingest.model.FetchOutcome;
import com.taggernews.ingest.model.ItemResult;
import com.taggernews.ingest.model.JobName;
import com.taggernews.ingest.model.StoryDraft;
import com.taggernews.ingest.model.StoryUpsertResult;
import com.taggernews.ingest.persistence.FetchFailureRepository;
import com.taggernews.ingest.persistence.StoryJdbcRepository;
import com.taggernews.ingest.util.FetchErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Fetch-with-retry and idempotent story upsert shared by the scraping jobs.
 */
@Service
public class StoryIngestor {
    private static final Logger log = LoggerFactory.getLogger(StoryIngestor.class);

    private final ContentSource contentSource;
    private final StoryJdbcRepository storyRepository;
    private final FetchFailureRepository fetchFailureRepository;
    private final IngestionProperties.Fetch fetchProperties;

    public StoryIngestor(
        ContentSource contentSource,
        StoryJdbcRepository storyRepository,
        FetchFailureRepository fetchFailureRepository,
        IngestionProperties properties
    ) {
        this.contentSource = contentSource;
        this.storyRepository = storyRepository;
        this.fetchFailureRepository = fetchFailureRepository;
        this.fetchProperties = properties.getFetch();
    }

    /**
     * @throws TransientFetchException when the source stays unreachable after all retries
     */
    public long maxItemId() {
        return withRetry("maxitem", contentSource::maxItemId);
    }

    public List<Long> topStoryIds(int limit) {
        return withRetry("topstories", () -> contentSource.topStoryIds(limit));
    }

    /**
     * Fetches one item, retrying transient failures with exponential backoff and jitter.
     * Never throws for per-item problems; the outcome says what happened.
     */
    public FetchOutcome fetch(long externalId) {
        int maxAttempts = Math.max(1, 1 + fetchProperties.getMaxRetries());
        TransientFetchException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return FetchOutcome.failed(externalId, FetchOutcome.Type.INTERRUPTED, FetchErrorClassifier.INTERRUPTED);
            }
            try {
                return FetchOutcome.found(contentSource.fetchItem(externalId));
            } catch (PermanentFetchException e) {
                log.debug("Item {} skipped: {} ({})", externalId, e.getReason(), e.getMessage());
                return FetchOutcome.failed(externalId, FetchOutcome.Type.PERMANENT_FAILURE, e.getReason());
            } catch (TransientFetchException e) {
                if (FetchErrorClassifier.INTERRUPTED.equals(e.getReason())) {
                    return FetchOutcome.failed(externalId, FetchOutcome.Type.INTERRUPTED, e.getReason());
                }
                last = e;
                log.debug("Transient failure fetching item {} (attempt {}/{}): {}", externalId, attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts && !sleepBackoff(attempt)) {
                return FetchOutcome.failed(externalId, FetchOutcome.Type.INTERRUPTED, FetchErrorClassifier.INTERRUPTED);
            }
        }
        String reason = last == null ? FetchErrorClassifier.UNKNOWN : last.getReason() + ": " + last.getMessage();
        return FetchOutcome.failed(externalId, FetchOutcome.Type.TRANSIENT_EXHAUSTED, reason);
    }

    private StoryUpsertResult store(ContentItem item) {
        return storyRepository.upsert(StoryDraft.from(item));
    }

    /**
     * Stores a story, or returns empty when the row could not be written.
     */
    public Optional<StoryUpsertResult> tryStore(ContentItem item) {
        try {
            return Optional.of(store(item));
        } catch (DataAccessException | IllegalStateException e) {
            log.warn("Could not store story {}", item.id(), e);
            return Optional.empty();
        }
    }

    private int recordSkipped(long externalId, JobName job, String reason) {
        int attempts = fetchFailureRepository.recordFailure(externalId, job, reason);
        log.warn("Item {} skipped by {}: {}", externalId, job.key(), reason);
        return attempts;
    }

    /**
     * Fetches and stores one id. See {@link #resolve(FetchOutcome, JobName)}.
     */
    public ItemResult ingest(long externalId, JobName job) {
        return resolve(fetch(externalId), job);
    }

    /**
     * Stores a fetched story; other item types are skipped without a write. Ids whose transient
     * retries ran out, and stories that could not be written, go to the failure ledger so the
     * caller can move past them.
     */
    public ItemResult resolve(FetchOutcome outcome, JobName job) {
        switch (outcome.type()) {
            case FOUND -> {
                if (!outcome.item().isStory()) {
                    return new ItemResult(outcome, null);
                }
                Optional<StoryUpsertResult> stored = tryStore(outcome.item());
                if (stored.isPresent()) {
                    return new ItemResult(outcome, stored.get());
                }
                FetchOutcome unstored = FetchOutcome.failed(
                    outcome.externalId(),
                    FetchOutcome.Type.TRANSIENT_EXHAUSTED,
                    FetchErrorClassifier.STORE_FAILED
                );
                recordSkipped(outcome.externalId(), job, unstored.reason());
                return new ItemResult(unstored, null);
            }
            case TRANSIENT_EXHAUSTED -> recordSkipped(outcome.externalId(), job, outcome.reason());
            default -> {
            }
        }
        return new ItemResult(outcome, null);
    }

    /**
     * Sleeps between items. Returns false when the thread was interrupted.
     */
    public boolean pause(int delayMs) {
        if (delayMs <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        int maxAttempts = Math.max(1, 1 + fetchProperties.getMaxRetries());
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (TransientFetchException e) {
                if (attempt >= maxAttempts || FetchErrorClassifier.INTERRUPTED.equals(e.getReason())) {
                    throw e;
                }
                log.debug("Transient failure calling {} (attempt {}/{}): {}", operation, attempt, maxAttempts, e.getMessage());
                if (!sleepBackoff(attempt)) {
                    throw e;
                }
            }
        }
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = fetchProperties.getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        int maxDelayMs = fetchProperties.getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.min(20, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
