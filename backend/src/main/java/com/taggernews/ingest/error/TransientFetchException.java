package com.taggernews.ingest.error;

/**
 * A fetch that may succeed if retried: network errors, timeouts, 408, 429 and 5xx responses.
 */
public class TransientFetchException extends RuntimeException {
    private final String reason;

    public TransientFetchException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TransientFetchException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
