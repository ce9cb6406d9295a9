package com.taggernews.ingest.model;

import java.util.Map;

/**
 * Outcome of one job body execution. {@code details} carries job specific counters.
 */
public record JobRunSummary(
    JobName jobName,
    long itemsProcessed,
    long storiesFound,
    Map<String, Object> details
) {
    public JobRunSummary {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static JobRunSummary skipped(JobName jobName, String reason) {
        return new JobRunSummary(jobName, 0, 0, Map.of("skipped", reason));
    }
}
