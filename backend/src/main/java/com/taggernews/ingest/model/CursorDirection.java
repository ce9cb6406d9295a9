package com.taggernews.ingest.model;

public enum CursorDirection {
    FORWARD,
    BACKWARD,
    NONE
}
