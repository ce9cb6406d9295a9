package com.taggernews.ingest.model;

import java.util.Locale;

/**
 * Identifies a recurring job and the direction its cursor is allowed to move.
 */
public enum JobName {
    CONTINUOUS_SYNC("continuous_sync", CursorDirection.FORWARD),
    BACKFILL("backfill", CursorDirection.BACKWARD),
    RECOVERY_SWEEP("recovery_sweep", CursorDirection.NONE),
    TAXONOMY_AGENT("taxonomy_agent", CursorDirection.NONE);

    private final String key;
    private final CursorDirection direction;

    JobName(String key, CursorDirection direction) {
        this.key = key;
        this.direction = direction;
    }

    public String key() {
        return key;
    }

    public CursorDirection direction() {
        return direction;
    }

    public static JobName fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("job name is required");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (JobName job : values()) {
            if (job.key.equals(normalized)) {
                return job;
            }
        }
        throw new IllegalArgumentException("unknown job name: " + key);
    }
}
