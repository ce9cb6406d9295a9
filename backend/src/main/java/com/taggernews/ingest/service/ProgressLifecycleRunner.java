package com.taggernews.ingest.service;

import com.taggernews.config.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Releases jobs left {@code running} by a previous process so their schedule can start again.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ProgressLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ProgressLifecycleRunner.class);

    private final ProgressStore progressStore;
    private final IngestionProperties properties;
    private final Clock clock;

    public ProgressLifecycleRunner(ProgressStore progressStore, IngestionProperties properties, Clock clock) {
        this.progressStore = progressStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(properties.getStaleRunMinutes()));
        int aborted;
        try {
            aborted = progressStore.abandonStaleRuns(cutoff);
        } catch (Exception e) {
            log.warn("Skipping stale run cleanup because the progress table is unreachable", e);
            return;
        }
        if (aborted > 0) {
            log.info("Aborted {} stale job run(s) started before {}", aborted, cutoff);
        }
    }
}
