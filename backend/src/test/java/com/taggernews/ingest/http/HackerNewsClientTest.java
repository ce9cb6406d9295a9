package com.taggernews.ingest.http;

import com.taggernews.config.IngestionConfig;
import com.taggernews.config.IngestionProperties;
import com.taggernews.ingest.error.PermanentFetchException;
import com.taggernews.ingest.error.TransientFetchException;
import com.taggernews.ingest.model.ContentItem;
import com.taggernews.ingest.util.FetchErrorClassifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HackerNewsClientTest {
    private MockWebServer server;
    private HackerNewsClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        IngestionProperties properties = new IngestionProperties();
        properties.getContentSource().setBaseUrl(server.url("/v0/").toString());
        properties.getContentSource().setRequestTimeoutSeconds(5);
        client = new HackerNewsClient(properties, new IngestionConfig().objectMapper());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void parsesStoryItem() throws Exception {
        server.enqueue(json("""
            {"id": 8863, "type": "story", "title": "My YC app", "url": "http://www.getdropbox.com/u/2/screencast.html",
             "score": 111, "by": "dhouston", "descendants": 71, "time": 1175714200, "kids": [8952, 9224]}
            """));

        ContentItem item = client.fetchItem(8863);

        assertTrue(item.isStory());
        assertEquals("dhouston", item.author());
        assertEquals(71, item.commentCount());
        assertEquals(1175714200L, item.time());
        RecordedRequest request = server.takeRequest();
        assertEquals("/v0/item/8863.json", request.getPath());
        assertThat(request.getHeader("User-Agent")).startsWith("taggernews-ingest");
    }

    @Test
    void nullBodyIsPermanentlyMissing() {
        server.enqueue(json("null"));

        PermanentFetchException error = assertThrows(PermanentFetchException.class, () -> client.fetchItem(1));
        assertEquals(FetchErrorClassifier.MISSING, error.getReason());
    }

    @Test
    void deletedAndDeadItemsArePermanent() {
        server.enqueue(json("{\"id\": 2, \"type\": \"story\", \"deleted\": true}"));
        server.enqueue(json("{\"id\": 3, \"type\": \"story\", \"dead\": true}"));

        assertEquals(FetchErrorClassifier.DELETED,
            assertThrows(PermanentFetchException.class, () -> client.fetchItem(2)).getReason());
        assertEquals(FetchErrorClassifier.DEAD,
            assertThrows(PermanentFetchException.class, () -> client.fetchItem(3)).getReason());
    }

    @Test
    void serverErrorsAndRateLimitsAreTransient() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(429));

        assertEquals(FetchErrorClassifier.HTTP_5XX,
            assertThrows(TransientFetchException.class, () -> client.fetchItem(4)).getReason());
        assertEquals(FetchErrorClassifier.HTTP_429_RATE_LIMIT,
            assertThrows(TransientFetchException.class, () -> client.fetchItem(4)).getReason());
    }

    @Test
    void clientErrorsArePermanent() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertEquals(FetchErrorClassifier.HTTP_4XX,
            assertThrows(PermanentFetchException.class, () -> client.fetchItem(5)).getReason());
    }

    @Test
    void malformedJsonIsUnparseable() {
        server.enqueue(json("{not json"));

        assertEquals(FetchErrorClassifier.UNPARSEABLE,
            assertThrows(PermanentFetchException.class, () -> client.fetchItem(6)).getReason());
    }

    @Test
    void readsMaxItemAndLimitsTopStories() throws Exception {
        server.enqueue(json("41234567"));
        server.enqueue(json("[10, 9, 8, 7, 6]"));

        assertEquals(41234567L, client.maxItemId());
        assertThat(client.topStoryIds(3)).containsExactly(10L, 9L, 8L);
        assertEquals("/v0/maxitem.json", server.takeRequest().getPath());
        assertEquals("/v0/topstories.json", server.takeRequest().getPath());
    }

    @Test
    void zeroTopStoryLimitMakesNoRequest() {
        assertThat(client.topStoryIds(0)).isEmpty();
        assertEquals(0, server.getRequestCount());
    }

    private MockResponse json(String body) {
        return new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }
}
