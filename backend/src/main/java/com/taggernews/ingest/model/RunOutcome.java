package com.taggernews.ingest.model;

public enum RunOutcome {
    SUCCEEDED,
    FAILED
}
