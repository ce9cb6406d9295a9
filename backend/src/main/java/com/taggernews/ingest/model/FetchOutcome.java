package com.taggernews.ingest.model;

/**
 * Result of fetching one id after retries. Only {@link Type#INTERRUPTED} leaves the id unresolved.
 */
public record FetchOutcome(
    long externalId,
    Type type,
    ContentItem item,
    String reason
) {
    public enum Type {
        FOUND,
        PERMANENT_FAILURE,
        TRANSIENT_EXHAUSTED,
        INTERRUPTED
    }

    public static FetchOutcome found(ContentItem item) {
        return new FetchOutcome(item.id(), Type.FOUND, item, null);
    }

    public static FetchOutcome failed(long externalId, Type type, String reason) {
        return new FetchOutcome(externalId, type, null, reason);
    }

    public boolean isResolved() {
        return type != Type.INTERRUPTED;
    }
}
