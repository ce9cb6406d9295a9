package com.taggernews.ingest.model;

public enum StoryStatus {
    PENDING("pending"),
    SUMMARIZED("summarized"),
    TAGGED("tagged"),
    FAILED_PENDING("failed_pending"),
    FAILED("failed");

    private final String dbValue;

    StoryStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean isEnriched() {
        return this == SUMMARIZED || this == TAGGED;
    }

    public static StoryStatus fromDb(String value) {
        for (StoryStatus status : values()) {
            if (status.dbValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown story status: " + value);
    }
}
