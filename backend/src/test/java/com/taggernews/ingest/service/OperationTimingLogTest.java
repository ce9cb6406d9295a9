package com.taggernews.ingest.service;

import com.taggernews.config.IngestionProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class OperationTimingLogTest {

    @TempDir
    Path tempDir;

    @Test
    void appendsRowsUnderASingleHeader() throws Exception {
        Path file = tempDir.resolve("timings/ingest.csv");
        IngestionProperties properties = new IngestionProperties();
        properties.getTimingLog().setEnabled(true);
        properties.getTimingLog().setPath(file.toString());
        OperationTimingLog log = new OperationTimingLog(properties, Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC));

        log.record("continuous_sync", Duration.ofMillis(1500), 12, true);
        log.record("enrichment_batch", Duration.ofMillis(20), 5, false);

        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            assertEquals(List.of(OperationTimingLog.HEADER), parser.getHeaderNames());
            List<CSVRecord> rows = parser.getRecords();
            assertEquals(2, rows.size());
            assertEquals("continuous_sync", rows.get(0).get("operation"));
            assertEquals("1500.00", rows.get(0).get("duration_ms"));
            assertEquals("12", rows.get(0).get("item_count"));
            assertEquals("false", rows.get(1).get("success"));
            assertEquals("2026-03-01T00:00:00Z", rows.get(1).get("timestamp"));
        }
    }

    @Test
    void disabledLogWritesNothing() {
        Path file = tempDir.resolve("never.csv");
        IngestionProperties properties = new IngestionProperties();
        properties.getTimingLog().setPath(file.toString());

        new OperationTimingLog(properties, Clock.systemUTC()).record("backfill", Duration.ofMillis(5), 1, true);

        assertFalse(Files.exists(file));
    }
}
