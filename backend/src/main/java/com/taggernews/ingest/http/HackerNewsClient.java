package com.taggernews.ingest.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taggernews.config.IngestionProperties;
import com.taggernews.ingest.error.PermanentFetchException;
import com.taggernews.ingest.error.TransientFetchException;
import com.taggernews.ingest.model.ContentItem;
import com.taggernews.ingest.model.HttpFetchResult;
import com.taggernews.ingest.util.FetchErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Content source backed by the Hacker News Firebase API ({@code /maxitem.json}, {@code /item/{id}.json},
 * {@code /topstories.json}).
 */
@Service
public class HackerNewsClient implements ContentSource {
    private static final Logger log = LoggerFactory.getLogger(HackerNewsClient.class);
    private static final TypeReference<List<Long>> ID_LIST = new TypeReference<>() {};

    private final IngestionProperties.ContentSource properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;
    private final Object spacingLock = new Object();
    private Instant nextAllowed = Instant.EPOCH;

    public HackerNewsClient(IngestionProperties properties, ObjectMapper objectMapper) {
        this.properties = properties.getContentSource();
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public long maxItemId() {
        String body = fetchJson("/maxitem.json");
        try {
            Long value = objectMapper.readValue(body, Long.class);
            if (value == null) {
                throw new PermanentFetchException(FetchErrorClassifier.MISSING, "maxitem returned null");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new PermanentFetchException(FetchErrorClassifier.UNPARSEABLE, "maxitem is not a number", e);
        }
    }

    @Override
    public ContentItem fetchItem(long id) {
        String body = fetchJson("/item/" + id + ".json");
        if (body == null || body.isBlank() || "null".equals(body.trim())) {
            throw new PermanentFetchException(FetchErrorClassifier.MISSING, "item " + id + " does not exist");
        }
        ContentItem item;
        try {
            item = objectMapper.readValue(body, ContentItem.class);
        } catch (JsonProcessingException e) {
            throw new PermanentFetchException(FetchErrorClassifier.UNPARSEABLE, "item " + id + " is not valid JSON", e);
        }
        if (item.deleted()) {
            throw new PermanentFetchException(FetchErrorClassifier.DELETED, "item " + id + " is deleted");
        }
        if (item.dead()) {
            throw new PermanentFetchException(FetchErrorClassifier.DEAD, "item " + id + " is dead");
        }
        return item;
    }

    @Override
    public List<Long> topStoryIds(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        String body = fetchJson("/topstories.json");
        try {
            List<Long> ids = objectMapper.readValue(body, ID_LIST);
            if (ids == null) {
                return List.of();
            }
            return ids.size() <= limit ? ids : List.copyOf(ids.subList(0, limit));
        } catch (JsonProcessingException e) {
            throw new PermanentFetchException(FetchErrorClassifier.UNPARSEABLE, "topstories is not a list of ids", e);
        }
    }

    private String fetchJson(String path) {
        HttpFetchResult result = executeOnce(baseUrl() + path);
        if (result.errorCode() != null) {
            String reason = FetchErrorClassifier.fromErrorCode(result.errorCode(), result.errorMessage());
            if (FetchErrorClassifier.INVALID_URL.equals(reason)) {
                throw new PermanentFetchException(reason, result.errorMessage());
            }
            throw new TransientFetchException(reason, path + ": " + result.errorMessage());
        }
        int status = result.statusCode();
        if (status < 200 || status >= 300) {
            String reason = FetchErrorClassifier.fromHttpStatus(status);
            if (FetchErrorClassifier.isTransientStatus(status)) {
                throw new TransientFetchException(reason, path + " returned HTTP " + status);
            }
            throw new PermanentFetchException(reason, path + " returned HTTP " + status);
        }
        log.debug("Fetched {} in {} ms", path, result.duration().toMillis());
        return result.body();
    }

    private HttpFetchResult executeOnce(String url) {
        Instant startedAt = Instant.now();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        }
        try {
            enforceMinInterval();
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", IngestionProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", "application/json")
                .GET()
                .build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        }
    }

    private void enforceMinInterval() throws InterruptedException {
        int spacingMs = properties.getMinRequestIntervalMs();
        if (spacingMs <= 0) {
            return;
        }
        synchronized (spacingLock) {
            Instant now = Instant.now();
            if (nextAllowed.isAfter(now)) {
                long sleepMs = Duration.between(now, nextAllowed).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            nextAllowed = Instant.now().plusMillis(spacingMs);
        }
    }

    private String baseUrl() {
        String base = properties.getBaseUrl();
        if (base == null || base.isBlank()) {
            return "https://hacker-news.firebaseio.com/v0";
        }
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
