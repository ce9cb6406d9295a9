package com.taggernews.ingest.model;

public enum RunStatus {
    IDLE("idle"),
    RUNNING("running"),
    ERROR("error");

    private final String dbValue;

    RunStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static RunStatus fromDb(String value) {
        for (RunStatus status : values()) {
            if (status.dbValue.equals(value)) {
                return status;
            }
        }
        return IDLE;
    }
}
