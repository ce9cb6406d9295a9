package com.taggernews.ingest.persistence;

import com.taggernews.ingest.model.StoryDraft;
import com.taggernews.ingest.model.StoryRecord;
import com.taggernews.ingest.model.StoryStatus;
import com.taggernews.ingest.model.StoryUpsertResult;
import com.taggernews.ingest.model.TagRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class StoryJdbcRepositoryTest {

    @Autowired
    private StoryJdbcRepository storyRepository;

    @Autowired
    private TagJdbcRepository tagRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void upsertingTheSameItemTwiceKeepsOneRowAndRefreshesScore() {
        StoryUpsertResult first = storyRepository.upsert(draft(9001L, "First title", 10));
        StoryUpsertResult second = storyRepository.upsert(draft(9001L, "Edited title", 42));

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(first.story().id(), second.story().id());
        assertEquals(1, countRows("SELECT COUNT(*) FROM stories WHERE external_id = 9001"));
        assertEquals(42, second.story().score());
        assertEquals("Edited title", second.story().title());
        assertEquals(StoryStatus.PENDING, second.story().status());
    }

    @Test
    void negativeCountsAreStoredAsZero() {
        StoryRecord story = storyRepository.upsert(
            new StoryDraft(9002L, "Negative", null, -5, null, -1, Instant.now())
        ).story();

        assertEquals(0, story.score());
        assertEquals(0, story.commentCount());
        assertEquals("unknown", story.author());
    }

    @Test
    void enrichingTwiceKeepsOneSummaryAndReplacesTags() {
        StoryRecord story = storyRepository.upsert(draft(9003L, "Rust in the kernel", 5)).story();
        TagRecord rust = tagRepository.getOrCreate("Rust", 2, "Tech Stacks");
        TagRecord linux = tagRepository.getOrCreate("Linux", 3, null);

        StoryStatus firstStatus = storyRepository.applyEnrichment(story.id(), "First summary", "m", List.of(rust.id(), linux.id()));
        StoryStatus secondStatus = storyRepository.applyEnrichment(story.id(), "Second summary", "m", List.of(rust.id()));

        assertEquals(StoryStatus.TAGGED, firstStatus);
        assertEquals(StoryStatus.TAGGED, secondStatus);
        assertEquals(1, countRows("SELECT COUNT(*) FROM summaries WHERE story_id = " + story.id()));
        assertEquals(Optional.of("Second summary"), storyRepository.findSummaryText(story.id()));
        assertEquals(List.of(rust.id()), storyRepository.findTagIds(story.id()));
    }

    @Test
    void enrichmentWithoutTagsLeavesStorySummarized() {
        StoryRecord story = storyRepository.upsert(draft(9004L, "No tags", 1)).story();

        StoryStatus status = storyRepository.applyEnrichment(story.id(), "Summary only", "m", List.of());

        assertEquals(StoryStatus.SUMMARIZED, status);
        assertEquals(StoryStatus.SUMMARIZED, storyRepository.findById(story.id()).orElseThrow().status());
    }

    @Test
    void thirdFailedAttemptMarksStoryFailed() {
        StoryRecord story = storyRepository.upsert(draft(9005L, "Flaky", 1)).story();

        assertEquals(Optional.of(StoryStatus.FAILED_PENDING), storyRepository.markEnrichmentFailed(story.id(), "timeout", 3));
        assertEquals(Optional.of(StoryStatus.FAILED_PENDING), storyRepository.markEnrichmentFailed(story.id(), "timeout", 3));
        assertEquals(Optional.of(StoryStatus.FAILED), storyRepository.markEnrichmentFailed(story.id(), "timeout", 3));
        assertEquals(Optional.empty(), storyRepository.markEnrichmentFailed(story.id(), "timeout", 3));

        StoryRecord failed = storyRepository.findById(story.id()).orElseThrow();
        assertEquals(3, failed.attemptCount());
        assertEquals("timeout", failed.lastError());
    }

    @Test
    void failedPendingSelectionIgnoresEnrichedAndFreshStories() {
        StoryRecord retry = storyRepository.upsert(draft(9006L, "Retry me", 1)).story();
        StoryRecord enriched = storyRepository.upsert(draft(9007L, "Done", 1)).story();
        storyRepository.upsert(draft(9008L, "Fresh", 1));

        storyRepository.markEnrichmentFailed(retry.id(), "boom", 3);
        storyRepository.applyEnrichment(enriched.id(), "Summary", "m", List.of());

        List<StoryRecord> due = storyRepository.findFailedPendingBefore(Instant.now().plusSeconds(60), 10);
        List<StoryRecord> notYetDue = storyRepository.findFailedPendingBefore(Instant.now().minusSeconds(3600), 10);

        assertThat(due).extracting(StoryRecord::externalId).containsExactly(9006L);
        assertThat(notYetDue).isEmpty();
    }

    @Test
    void enrichedStoryIsNotMarkedFailedAfterwards() {
        StoryRecord story = storyRepository.upsert(draft(9009L, "Raced", 1)).story();
        storyRepository.applyEnrichment(story.id(), "Summary", "m", List.of());

        assertEquals(Optional.empty(), storyRepository.markEnrichmentFailed(story.id(), "late failure", 3));
        assertEquals(StoryStatus.SUMMARIZED, storyRepository.findById(story.id()).orElseThrow().status());
    }

    @Test
    void countsEveryStatusIncludingEmptyOnes() {
        storyRepository.upsert(draft(9010L, "Counted", 1));

        Map<String, Long> counts = storyRepository.countByStatus();

        assertThat(counts).containsKeys("pending", "summarized", "tagged", "failed_pending", "failed");
        assertThat(counts.get("pending")).isGreaterThanOrEqualTo(1L);
    }

    @Test
    void tracksExternalIdBounds() {
        storyRepository.upsert(draft(9100L, "Low", 1));
        storyRepository.upsert(draft(9200L, "High", 1));

        assertThat(storyRepository.findMaxExternalId()).hasValueSatisfying(max -> assertThat(max).isGreaterThanOrEqualTo(9200L));
        assertThat(storyRepository.findMinExternalId()).hasValueSatisfying(min -> assertThat(min).isLessThanOrEqualTo(9100L));
    }

    private StoryDraft draft(long externalId, String title, int score) {
        return new StoryDraft(externalId, title, "https://example.com/" + externalId, score, "pg", 0, Instant.now());
    }

    private int countRows(String sql) {
        Integer count = jdbc.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
        return count == null ? 0 : count;
    }
}
