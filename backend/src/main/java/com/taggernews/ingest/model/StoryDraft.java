package com.taggernews.ingest.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Locale;

/**
 * Normalized story values ready to be upserted.
 */
public record StoryDraft(
    long externalId,
    String title,
    String url,
    int score,
    String author,
    int commentCount,
    Instant sourceCreatedAt
) {
    public static final String UNKNOWN_AUTHOR = "unknown";
    static final int MAX_TITLE_LENGTH = 1000;
    static final int MAX_URL_LENGTH = 2048;
    static final int MAX_AUTHOR_LENGTH = 255;

    public StoryDraft {
        score = Math.max(0, score);
        commentCount = Math.max(0, commentCount);
        author = author == null || author.isBlank() ? UNKNOWN_AUTHOR : truncate(author.trim(), MAX_AUTHOR_LENGTH);
        title = title == null ? "" : truncate(title.trim(), MAX_TITLE_LENGTH);
        url = safeUrl(url);
    }

    public static StoryDraft from(ContentItem item) {
        return new StoryDraft(
            item.id(),
            item.title(),
            item.url(),
            item.score() == null ? 0 : item.score(),
            item.author(),
            item.commentCount() == null ? 0 : item.commentCount(),
            item.time() == null ? null : Instant.ofEpochSecond(item.time())
        );
    }

    static String safeUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(candidate.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return null;
            }
            String value = uri.toString();
            // a cut url points somewhere else, so drop it instead
            return value.length() > MAX_URL_LENGTH ? null : value;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
