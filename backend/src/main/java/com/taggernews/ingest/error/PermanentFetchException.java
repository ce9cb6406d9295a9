package com.taggernews.ingest.error;

/**
 * The item is missing, deleted, dead or unreadable. Retrying will not help.
 */
public class PermanentFetchException extends RuntimeException {
    private final String reason;

    public PermanentFetchException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public PermanentFetchException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
