package com.taggernews.ingest.persistence;

import com.taggernews.ingest.model.StoryDraft;
import com.taggernews.ingest.model.StoryRecord;
import com.taggernews.ingest.model.StoryStatus;
import com.taggernews.ingest.model.StoryUpsertResult;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.taggernews.ingest.persistence.JdbcSupport.toInstant;
import static com.taggernews.ingest.persistence.JdbcSupport.toTimestamp;
import static com.taggernews.ingest.persistence.JdbcSupport.truncateError;

/**
 * Stories, their summaries and their tag links.
 */
@Repository
public class StoryJdbcRepository {
    private static final String STORY_COLUMNS = """
        id, external_id, title, url, score, author, comment_count, source_created_at, status,
        attempt_count, last_error, status_changed_at, created_at, updated_at
        """;

    private static final RowMapper<StoryRecord> STORY_MAPPER = (rs, rowNum) -> new StoryRecord(
        rs.getLong("id"),
        rs.getLong("external_id"),
        rs.getString("title"),
        rs.getString("url"),
        rs.getInt("score"),
        rs.getString("author"),
        rs.getInt("comment_count"),
        toInstant(rs.getTimestamp("source_created_at")),
        StoryStatus.fromDb(rs.getString("status")),
        rs.getInt("attempt_count"),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("status_changed_at")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;
    private final boolean postgres;

    public StoryJdbcRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
    }

    /**
     * Inserts the story or refreshes title, url, score and comment count of an existing one.
     * Status, author and attempts of an existing story are left alone.
     */
    public StoryUpsertResult upsert(StoryDraft draft) {
        Instant now = clock.instant();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("externalId", draft.externalId())
            .addValue("title", draft.title())
            .addValue("url", draft.url())
            .addValue("score", Math.max(0, draft.score()))
            .addValue("author", draft.author())
            .addValue("commentCount", Math.max(0, draft.commentCount()))
            .addValue("sourceCreatedAt", toTimestamp(draft.sourceCreatedAt()))
            .addValue("now", toTimestamp(now));

        boolean created = false;
        int updated = refresh(params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO stories (
                            external_id, title, url, score, author, comment_count, source_created_at,
                            status, attempt_count, status_changed_at, created_at, updated_at
                        )
                        VALUES (
                            :externalId, :title, :url, :score, :author, :commentCount, :sourceCreatedAt,
                            'pending', 0, :now, :now, :now
                        )
                        """,
                    params
                );
                created = true;
            } catch (DataIntegrityViolationException e) {
                // lost an insert race unless the row is still missing
                if (refresh(params) == 0) {
                    throw e;
                }
            }
        }

        StoryRecord story = findByExternalId(draft.externalId())
            .orElseThrow(() -> new IllegalStateException("Failed to upsert story " + draft.externalId()));
        return new StoryUpsertResult(story, created);
    }

    private int refresh(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE stories
                SET title = :title,
                    url = :url,
                    score = :score,
                    comment_count = :commentCount,
                    updated_at = :now
                WHERE external_id = :externalId
                """,
            params
        );
    }

    public Optional<StoryRecord> findByExternalId(long externalId) {
        List<StoryRecord> rows = jdbc.query(
            "SELECT " + STORY_COLUMNS + " FROM stories WHERE external_id = :externalId",
            new MapSqlParameterSource().addValue("externalId", externalId),
            STORY_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<StoryRecord> findById(long id) {
        List<StoryRecord> rows = jdbc.query(
            "SELECT " + STORY_COLUMNS + " FROM stories WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            STORY_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<Long> findMaxExternalId() {
        Long value = jdbc.queryForObject(
            "SELECT MAX(external_id) FROM stories",
            new MapSqlParameterSource(),
            Long.class
        );
        return Optional.ofNullable(value);
    }

    public Optional<Long> findMinExternalId() {
        Long value = jdbc.queryForObject(
            "SELECT MIN(external_id) FROM stories",
            new MapSqlParameterSource(),
            Long.class
        );
        return Optional.ofNullable(value);
    }

    /**
     * Stories waiting for a retry whose last status change is at or before the cutoff, oldest first.
     */
    public List<StoryRecord> findFailedPendingBefore(Instant cutoff, int limit) {
        return jdbc.query(
            "SELECT " + STORY_COLUMNS + """
                FROM stories
                WHERE status = 'failed_pending'
                  AND status_changed_at <= :cutoff
                ORDER BY status_changed_at ASC, id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("cutoff", toTimestamp(cutoff))
                .addValue("limit", Math.max(1, limit)),
            STORY_MAPPER
        );
    }

    public List<StoryRecord> findByStatus(StoryStatus status, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        return jdbc.query(
            "SELECT " + STORY_COLUMNS + """
                FROM stories
                WHERE status = :status
                ORDER BY status_changed_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("status", status.dbValue())
                .addValue("limit", safeLimit),
            STORY_MAPPER
        );
    }

    public Map<String, Long> countByStatus() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (StoryStatus status : StoryStatus.values()) {
            counts.put(status.dbValue(), 0L);
        }
        jdbc.query(
            """
                SELECT status, COUNT(*) AS story_count
                FROM stories
                GROUP BY status
                """,
            new MapSqlParameterSource(),
            rs -> {
                counts.put(rs.getString("status"), rs.getLong("story_count"));
            }
        );
        return counts;
    }

    /**
     * Writes the summary, replaces the tag set and moves the story to its enriched status, atomically.
     */
    @Transactional
    public StoryStatus applyEnrichment(long storyId, String summary, String model, Collection<Long> tagIds) {
        Instant now = clock.instant();
        upsertSummary(storyId, summary, model, now);

        MapSqlParameterSource storyParams = new MapSqlParameterSource().addValue("storyId", storyId);
        jdbc.update("DELETE FROM story_tags WHERE story_id = :storyId", storyParams);
        LinkedHashSet<Long> distinct = new LinkedHashSet<>(tagIds == null ? List.of() : tagIds);
        for (Long tagId : distinct) {
            jdbc.update(
                "INSERT INTO story_tags (story_id, tag_id) VALUES (:storyId, :tagId)",
                new MapSqlParameterSource()
                    .addValue("storyId", storyId)
                    .addValue("tagId", tagId)
            );
        }

        StoryStatus status = distinct.isEmpty() ? StoryStatus.SUMMARIZED : StoryStatus.TAGGED;
        jdbc.update(
            """
                UPDATE stories
                SET status = :status,
                    last_error = NULL,
                    status_changed_at = :now,
                    updated_at = :now
                WHERE id = :storyId
                """,
            new MapSqlParameterSource()
                .addValue("storyId", storyId)
                .addValue("status", status.dbValue())
                .addValue("now", toTimestamp(now))
        );
        return status;
    }

    private void upsertSummary(long storyId, String text, String model, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("storyId", storyId)
            .addValue("text", text == null ? "" : text.trim())
            .addValue("model", model)
            .addValue("now", toTimestamp(now));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO summaries (story_id, text, model, created_at)
                    VALUES (:storyId, :text, :model, :now)
                    ON CONFLICT (story_id)
                    DO UPDATE SET
                        text = EXCLUDED.text,
                        model = EXCLUDED.model,
                        created_at = EXCLUDED.created_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO summaries (story_id, text, model, created_at)
                KEY(story_id)
                VALUES (:storyId, :text, :model, :now)
                """,
            params
        );
    }

    /**
     * Counts one failed enrichment attempt. The story turns {@code failed} once the attempt budget is used up.
     * Stories that were enriched in the meantime are not touched.
     *
     * @return the status after the update, empty if the story was not eligible
     */
    public Optional<StoryStatus> markEnrichmentFailed(long storyId, String error, int maxAttempts) {
        Instant now = clock.instant();
        int updated = jdbc.update(
            """
                UPDATE stories
                SET attempt_count = attempt_count + 1,
                    status = CASE WHEN attempt_count + 1 >= :maxAttempts THEN 'failed' ELSE 'failed_pending' END,
                    last_error = :lastError,
                    status_changed_at = :now,
                    updated_at = :now
                WHERE id = :storyId
                  AND status IN ('pending', 'failed_pending')
                """,
            new MapSqlParameterSource()
                .addValue("storyId", storyId)
                .addValue("maxAttempts", Math.max(1, maxAttempts))
                .addValue("lastError", truncateError(error))
                .addValue("now", toTimestamp(now))
        );
        if (updated == 0) {
            return Optional.empty();
        }
        return findById(storyId).map(StoryRecord::status);
    }

    public Optional<String> findSummaryText(long storyId) {
        List<String> rows = jdbc.query(
            "SELECT text FROM summaries WHERE story_id = :storyId",
            new MapSqlParameterSource().addValue("storyId", storyId),
            (rs, rowNum) -> rs.getString("text")
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<Long> findTagIds(long storyId) {
        return jdbc.query(
            "SELECT tag_id FROM story_tags WHERE story_id = :storyId ORDER BY tag_id",
            new MapSqlParameterSource().addValue("storyId", storyId),
            (rs, rowNum) -> rs.getLong("tag_id")
        );
    }
}
