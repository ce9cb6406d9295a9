package com.taggernews.ingest.service;

import com.taggernews.config.IngestionProperties;
import com.taggernews.ingest.error.EnrichmentCallException;
import com.taggernews.ingest.http.EnrichmentClient;
import com.taggernews.ingest.model.EnrichmentResult;
import com.taggernews.ingest.model.StoryEnrichment;
import com.taggernews.ingest.model.StoryRecord;
import com.taggernews.ingest.model.StoryStatus;
import com.taggernews.ingest.model.TagRecord;
import com.taggernews.ingest.persistence.StoryJdbcRepository;
import com.taggernews.ingest.persistence.TagJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnrichmentStageTest {

    @Mock
    private EnrichmentClient enrichmentClient;
    @Mock
    private StoryJdbcRepository storyRepository;
    @Mock
    private TagJdbcRepository tagRepository;

    private IngestionProperties properties;
    private EnrichmentStage stage;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        properties.getEnrichment().setEnabled(true);
        properties.getEnrichment().setApiKey("key");
        properties.getEnrichment().setBatchSize(2);
        properties.getRecovery().setMaxAttempts(3);
        OperationTimingLog timingLog = new OperationTimingLog(properties, Clock.systemUTC());
        stage = new EnrichmentStage(enrichmentClient, storyRepository, tagRepository, timingLog, properties, Clock.systemUTC());
    }

    @Test
    void splitsStoriesIntoBatches() {
        List<StoryRecord> stories = LongStream.rangeClosed(1, 5).mapToObj(id -> story(id, StoryStatus.PENDING)).toList();
        when(enrichmentClient.enrich(anyList())).thenReturn(List.of());
        when(storyRepository.markEnrichmentFailed(anyLong(), anyString(), anyInt()))
            .thenReturn(Optional.of(StoryStatus.FAILED_PENDING));

        EnrichmentResult result = stage.enrich(stories);

        verify(enrichmentClient, times(3)).enrich(anyList());
        assertEquals(5, result.requested());
        assertEquals(5, result.failed());
        assertEquals(0, result.exhausted());
    }

    @Test
    void storesSummaryAndCanonicalTags() {
        StoryRecord story = story(1, StoryStatus.PENDING);
        when(enrichmentClient.enrich(anyList())).thenReturn(List.of(
            new StoryEnrichment(1, "Summary", List.of("tech"), List.of("rust"), List.of("Cargo"))
        ));
        when(enrichmentClient.modelName()).thenReturn("test-model");
        when(tagRepository.getOrCreate("Tech", 1, null)).thenReturn(tag(10, "Tech", 1));
        when(tagRepository.getOrCreate("Rust", 2, "Tech Stacks")).thenReturn(tag(11, "Rust", 2));
        when(tagRepository.getOrCreate("Cargo", 3, null)).thenReturn(tag(12, "Cargo", 3));
        when(storyRepository.applyEnrichment(1L, "Summary", "test-model", List.of(10L, 11L, 12L)))
            .thenReturn(StoryStatus.TAGGED);

        EnrichmentResult result = stage.enrich(List.of(story));

        assertEquals(1, result.enriched());
        verify(storyRepository, never()).markEnrichmentFailed(anyLong(), anyString(), anyInt());
    }

    @Test
    void tagRemovedWhileStoringIsResolvedAgainWithoutCostingAnAttempt() {
        StoryRecord story = story(1, StoryStatus.PENDING);
        when(enrichmentClient.enrich(anyList())).thenReturn(List.of(
            new StoryEnrichment(1, "Summary", List.of(), List.of(), List.of("Zig"))
        ));
        when(enrichmentClient.modelName()).thenReturn("test-model");
        when(tagRepository.getOrCreate("Zig", 3, null)).thenReturn(tag(20, "Zig", 3), tag(21, "Zig", 3));
        when(storyRepository.applyEnrichment(1L, "Summary", "test-model", List.of(20L)))
            .thenThrow(new DataIntegrityViolationException("story_tags_tag_id_fkey"));
        when(storyRepository.applyEnrichment(1L, "Summary", "test-model", List.of(21L)))
            .thenReturn(StoryStatus.TAGGED);

        EnrichmentResult result = stage.enrich(List.of(story));

        assertEquals(1, result.enriched());
        assertEquals(0, result.failed());
        verify(storyRepository, never()).markEnrichmentFailed(anyLong(), anyString(), anyInt());
    }

    @Test
    void batchTimingUsesInjectedClock() {
        Instant start = Instant.parse("2026-03-01T12:00:00Z");
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(start, start.plusMillis(250));
        OperationTimingLog timingLog = mock(OperationTimingLog.class);
        EnrichmentStage timed = new EnrichmentStage(enrichmentClient, storyRepository, tagRepository, timingLog, properties, clock);
        when(enrichmentClient.enrich(anyList())).thenReturn(List.of());
        when(storyRepository.markEnrichmentFailed(anyLong(), anyString(), anyInt()))
            .thenReturn(Optional.of(StoryStatus.FAILED_PENDING));

        timed.enrich(List.of(story(1, StoryStatus.PENDING)));

        verify(timingLog).record("enrichment_batch", Duration.ofMillis(250), 1, true);
    }

    @Test
    void storyMissingFromResponseIsMarkedFailed() {
        StoryRecord answered = story(1, StoryStatus.PENDING);
        StoryRecord missing = story(2, StoryStatus.FAILED_PENDING);
        when(enrichmentClient.enrich(anyList())).thenReturn(List.of(
            new StoryEnrichment(1, "Summary", List.of(), List.of(), List.of())
        ));
        when(enrichmentClient.modelName()).thenReturn("test-model");
        when(storyRepository.applyEnrichment(eq(1L), eq("Summary"), eq("test-model"), any()))
            .thenReturn(StoryStatus.SUMMARIZED);
        when(storyRepository.markEnrichmentFailed(2L, EnrichmentStage.MISSING_FROM_RESPONSE, 3))
            .thenReturn(Optional.of(StoryStatus.FAILED));

        EnrichmentResult result = stage.enrich(List.of(answered, missing));

        assertEquals(1, result.enriched());
        assertEquals(1, result.failed());
        assertEquals(1, result.exhausted());
    }

    @Test
    void failedCallMarksWholeBatch() {
        when(enrichmentClient.enrich(anyList())).thenThrow(new EnrichmentCallException("enrichment service returned HTTP 500"));
        when(storyRepository.markEnrichmentFailed(anyLong(), anyString(), anyInt()))
            .thenReturn(Optional.of(StoryStatus.FAILED_PENDING));

        EnrichmentResult result = stage.enrich(List.of(story(1, StoryStatus.PENDING), story(2, StoryStatus.PENDING)));

        assertEquals(2, result.failed());
        verify(storyRepository).markEnrichmentFailed(1L, "enrichment service returned HTTP 500", 3);
        verify(storyRepository).markEnrichmentFailed(2L, "enrichment service returned HTTP 500", 3);
    }

    @Test
    void enrichedStoriesAreNotSentAgain() {
        EnrichmentResult result = stage.enrich(List.of(story(1, StoryStatus.TAGGED), story(2, StoryStatus.FAILED)));

        assertEquals(0, result.requested());
        verifyNoInteractions(enrichmentClient, storyRepository);
    }

    @Test
    void disabledEnrichmentLeavesStoriesPending() {
        properties.getEnrichment().setEnabled(false);

        EnrichmentResult result = stage.enrich(List.of(story(1, StoryStatus.PENDING)));

        assertEquals(1, result.requested());
        assertEquals(0, result.enriched());
        verifyNoInteractions(enrichmentClient, storyRepository, tagRepository);
    }

    private StoryRecord story(long id, StoryStatus status) {
        Instant now = Instant.now();
        return new StoryRecord(id, id, "Story " + id, null, 1, "pg", 0, now, status, 0, null, now, now, now);
    }

    private TagRecord tag(long id, String name, int level) {
        return new TagRecord(id, name, name.toLowerCase(), level, null, Instant.now());
    }
}
