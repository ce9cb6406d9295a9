package com.taggernews.ingest.service;

import com.taggernews.config.IngestionProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Appends one CSV row per timed operation when enabled. Write failures are logged and never fail the caller.
 */
@Component
public class OperationTimingLog {
    private static final Logger log = LoggerFactory.getLogger(OperationTimingLog.class);
    static final String[] HEADER = {"timestamp", "operation", "duration_ms", "item_count", "success"};

    private final boolean enabled;
    private final Path path;
    private final Clock clock;
    private final Object writeLock = new Object();

    public OperationTimingLog(IngestionProperties properties, Clock clock) {
        this.enabled = properties.getTimingLog().isEnabled();
        String configured = properties.getTimingLog().getPath();
        this.path = Path.of(configured == null || configured.isBlank() ? "ingest-timings.csv" : configured);
        this.clock = clock;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void record(String operation, Duration duration, int itemCount, boolean success) {
        if (!enabled) {
            return;
        }
        synchronized (writeLock) {
            try {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                boolean writeHeader = !Files.exists(path) || Files.size(path) == 0;
                CSVFormat format = writeHeader
                    ? CSVFormat.DEFAULT.builder().setHeader(HEADER).build()
                    : CSVFormat.DEFAULT;
                try (Writer writer = Files.newBufferedWriter(
                    path,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
                );
                     CSVPrinter printer = new CSVPrinter(writer, format)) {
                    printer.printRecord(
                        clock.instant().toString(),
                        operation,
                        String.format(Locale.ROOT, "%.2f", duration.toNanos() / 1_000_000.0),
                        itemCount,
                        success
                    );
                }
            } catch (IOException e) {
                log.warn("Failed to append timing row for {} to {}", operation, path, e);
            }
        }
    }
}
