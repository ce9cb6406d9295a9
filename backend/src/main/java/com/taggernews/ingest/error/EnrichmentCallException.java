package com.taggernews.ingest.error;

public class EnrichmentCallException extends RuntimeException {
    public EnrichmentCallException(String message) {
        super(message);
    }

    public EnrichmentCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
