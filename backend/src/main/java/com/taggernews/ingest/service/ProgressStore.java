package com.taggernews.ingest.service;

import com.taggernews.ingest.model.JobName;
import com.taggernews.ingest.model.ProgressRecord;
import com.taggernews.ingest.model.RunOutcome;
import com.taggernews.ingest.persistence.ProgressJdbcRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable per-job position and run state. Every job reads and moves its cursor only through here.
 */
@Service
public class ProgressStore {
    private final ProgressJdbcRepository repository;
    private final Clock clock;

    public ProgressStore(ProgressJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public Optional<Long> getCursor(JobName job) {
        return repository.find(job).map(ProgressRecord::cursorValue);
    }

    public Optional<ProgressRecord> find(JobName job) {
        return repository.find(job);
    }

    public List<ProgressRecord> findAll() {
        return repository.findAll();
    }

    /**
     * @return false when a run of the same job is still in flight; the trigger should be skipped
     */
    public boolean tryBeginRun(JobName job) {
        return repository.tryBeginRun(job, clock.instant());
    }

    /**
     * Moves the cursor in the job's direction. A value behind the stored cursor is ignored.
     */
    public boolean advanceCursor(JobName job, long value) {
        repository.ensureRow(job);
        return repository.advanceCursor(job, value);
    }

    /**
     * Seeds the cursor of a job that has none yet.
     */
    public long initializeCursor(JobName job, long value) {
        repository.ensureRow(job);
        repository.initializeCursor(job, value);
        return getCursor(job).orElse(value);
    }

    public void resetCursor(JobName job, Long value) {
        repository.ensureRow(job);
        repository.resetCursor(job, value);
    }

    public void endRun(JobName job, RunOutcome outcome) {
        repository.endRun(job, outcome, clock.instant());
    }

    public void recordFailure(JobName job, String error) {
        repository.recordFailure(job, error);
    }

    public void markCompleted(JobName job) {
        repository.markCompleted(job, true);
    }

    public void reconfigure(JobName job, String configKey) {
        repository.ensureRow(job);
        repository.reconfigure(job, configKey);
    }

    public void recordCounters(JobName job, long itemsProcessed, long storiesFound) {
        repository.recordCounters(job, itemsProcessed, storiesFound);
    }

    public int abandonStaleRuns(Instant cutoff) {
        return repository.abandonStaleRuns(cutoff, clock.instant());
    }
}
