package com.taggernews.ingest.service;

import com.taggernews.config.IngestionConfig;
import com.taggernews.config.IngestionProperties;
import com.taggernews.ingest.model.JobName;
import com.taggernews.ingest.model.JobRunSummary;
import com.taggernews.ingest.model.RunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * One fixed-rate timer per job. A tick only runs the job body when the progress store grants the run,
 * and no exception ever escapes a tick, so one job failing never cancels another job's schedule.
 */
@Service
@Order(Ordered.LOWEST_PRECEDENCE)
public class JobScheduler implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final Map<JobName, ScheduledJob> jobs = new EnumMap<>(JobName.class);
    private final Map<JobName, ScheduledFuture<?>> schedules = new EnumMap<>(JobName.class);
    private final ProgressStore progressStore;
    private final IngestionProperties properties;
    private final TaskScheduler taskScheduler;
    private final OperationTimingLog timingLog;
    private final Clock clock;
    private final Object lifecycleLock = new Object();

    public JobScheduler(
        List<ScheduledJob> jobs,
        ProgressStore progressStore,
        IngestionProperties properties,
        @Qualifier(IngestionConfig.JOB_SCHEDULER) TaskScheduler taskScheduler,
        OperationTimingLog timingLog,
        Clock clock
    ) {
        for (ScheduledJob job : jobs) {
            this.jobs.put(job.name(), job);
        }
        this.progressStore = progressStore;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.timingLog = timingLog;
        this.clock = clock;
    }

    /**
     * Invalid intervals or thresholds abort startup before anything is scheduled.
     */
    @PostConstruct
    public void validateConfiguration() {
        properties.validate();
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Job scheduling disabled; jobs run only when triggered");
            return;
        }
        start();
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (!schedules.isEmpty()) {
                return;
            }
            Instant firstRun = clock.instant().plus(properties.getScheduler().getInitialDelay());
            for (ScheduledJob job : jobs.values()) {
                Duration interval = job.interval();
                ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(() -> tick(job.name()), firstRun, interval);
                schedules.put(job.name(), future);
                log.info("Scheduled {} every {}", job.name().key(), interval);
            }
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            for (ScheduledFuture<?> future : schedules.values()) {
                future.cancel(true);
            }
            schedules.clear();
        }
    }

    public boolean isScheduled(JobName job) {
        synchronized (lifecycleLock) {
            return schedules.containsKey(job);
        }
    }

    /**
     * Runs the job once on the calling thread, subject to the same single-run rule as scheduled ticks.
     *
     * @return the run summary, or empty when the run was skipped or failed
     */
    public Optional<JobRunSummary> triggerNow(JobName job) {
        return tick(job);
    }

    Optional<JobRunSummary> tick(JobName jobName) {
        ScheduledJob job = jobs.get(jobName);
        if (job == null) {
            log.warn("No job registered for {}", jobName.key());
            return Optional.empty();
        }
        boolean granted;
        try {
            granted = progressStore.tryBeginRun(jobName);
        } catch (Exception e) {
            log.warn("Could not begin {} run; skipping this trigger", jobName.key(), e);
            return Optional.empty();
        }
        if (!granted) {
            log.debug("Skipping {} trigger; previous run still in flight", jobName.key());
            return Optional.empty();
        }

        Instant startedAt = clock.instant();
        try {
            JobRunSummary summary = job.run();
            progressStore.recordCounters(jobName, summary.itemsProcessed(), summary.storiesFound());
            progressStore.endRun(jobName, RunOutcome.SUCCEEDED);
            timingLog.record(jobName.key(), Duration.between(startedAt, clock.instant()), (int) summary.itemsProcessed(), true);
            return Optional.of(summary);
        } catch (Exception e) {
            log.warn("Job {} failed", jobName.key(), e);
            timingLog.record(jobName.key(), Duration.between(startedAt, clock.instant()), 0, false);
            finishFailedRun(jobName, e);
            return Optional.empty();
        }
    }

    private void finishFailedRun(JobName jobName, Exception failure) {
        try {
            progressStore.recordFailure(jobName, failure.getClass().getSimpleName() + ": " + failure.getMessage());
            progressStore.endRun(jobName, RunOutcome.FAILED);
        } catch (Exception e) {
            log.warn("Could not record failure of {}", jobName.key(), e);
        }
    }
}
