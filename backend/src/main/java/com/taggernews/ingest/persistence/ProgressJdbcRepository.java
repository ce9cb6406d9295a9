package com.taggernews.ingest.persistence;

import com.taggernews.ingest.model.CursorDirection;
import com.taggernews.ingest.model.JobName;
import com.taggernews.ingest.model.ProgressRecord;
import com.taggernews.ingest.model.RunOutcome;
import com.taggernews.ingest.model.RunStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.taggernews.ingest.persistence.JdbcSupport.nullableLong;
import static com.taggernews.ingest.persistence.JdbcSupport.toInstant;
import static com.taggernews.ingest.persistence.JdbcSupport.toTimestamp;
import static com.taggernews.ingest.persistence.JdbcSupport.truncateError;

@Repository
public class ProgressJdbcRepository {
    private static final RowMapper<ProgressRecord> PROGRESS_MAPPER = (rs, rowNum) -> new ProgressRecord(
        JobName.fromKey(rs.getString("job_name")),
        nullableLong(rs, "cursor_value"),
        RunStatus.fromDb(rs.getString("status")),
        rs.getBoolean("completed"),
        rs.getString("config_key"),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("last_run_at")),
        toInstant(rs.getTimestamp("last_success_at")),
        rs.getInt("failure_count"),
        rs.getString("last_error"),
        rs.getLong("items_processed"),
        rs.getLong("stories_found")
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public ProgressJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = JdbcSupport.detectPostgres(jdbc);
    }

    public void ensureRow(JobName job) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobName", job.key());
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO progress (job_name, status)
                    VALUES (:jobName, 'idle')
                    ON CONFLICT (job_name) DO NOTHING
                    """,
                params
            );
            return;
        }
        if (find(job).isPresent()) {
            return;
        }
        jdbc.update(
            """
                MERGE INTO progress (job_name)
                KEY(job_name)
                VALUES (:jobName)
                """,
            params
        );
    }

    public Optional<ProgressRecord> find(JobName job) {
        List<ProgressRecord> rows = jdbc.query(
            """
                SELECT job_name, cursor_value, status, completed, config_key, started_at, last_run_at,
                       last_success_at, failure_count, last_error, items_processed, stories_found
                FROM progress
                WHERE job_name = :jobName
                """,
            new MapSqlParameterSource().addValue("jobName", job.key()),
            PROGRESS_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<ProgressRecord> findAll() {
        return jdbc.query(
            """
                SELECT job_name, cursor_value, status, completed, config_key, started_at, last_run_at,
                       last_success_at, failure_count, last_error, items_processed, stories_found
                FROM progress
                ORDER BY job_name
                """,
            new MapSqlParameterSource(),
            PROGRESS_MAPPER
        );
    }

    /**
     * Flips the row to running unless it already is. The check and the write are one statement.
     */
    public boolean tryBeginRun(JobName job, Instant now) {
        ensureRow(job);
        int updated = jdbc.update(
            """
                UPDATE progress
                SET status = 'running',
                    started_at = :now
                WHERE job_name = :jobName
                  AND status <> 'running'
                """,
            new MapSqlParameterSource()
                .addValue("jobName", job.key())
                .addValue("now", toTimestamp(now))
        );
        return updated == 1;
    }

    /**
     * Writes the cursor only when the new value moves it in the job's direction.
     *
     * @return true when the stored cursor changed
     */
    public boolean advanceCursor(JobName job, long value) {
        CursorDirection direction = job.direction();
        if (direction == CursorDirection.NONE) {
            throw new IllegalArgumentException(job.key() + " does not keep a cursor");
        }
        String comparison = direction == CursorDirection.FORWARD ? "cursor_value < :value" : "cursor_value > :value";
        int updated = jdbc.update(
            """
                UPDATE progress
                SET cursor_value = :value
                WHERE job_name = :jobName
                  AND (cursor_value IS NULL OR %s)
                """.formatted(comparison),
            new MapSqlParameterSource()
                .addValue("jobName", job.key())
                .addValue("value", value)
        );
        return updated == 1;
    }

    public boolean initializeCursor(JobName job, long value) {
        int updated = jdbc.update(
            """
                UPDATE progress
                SET cursor_value = :value
                WHERE job_name = :jobName
                  AND cursor_value IS NULL
                """,
            new MapSqlParameterSource()
                .addValue("jobName", job.key())
                .addValue("value", value)
        );
        return updated == 1;
    }

    public void resetCursor(JobName job, Long value) {
        jdbc.update(
            """
                UPDATE progress
                SET cursor_value = :value,
                    completed = FALSE
                WHERE job_name = :jobName
                """,
            new MapSqlParameterSource()
                .addValue("jobName", job.key())
                .addValue("value", value)
        );
    }

    public void endRun(JobName job, RunOutcome outcome, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobName", job.key())
            .addValue("now", toTimestamp(now));
        if (outcome == RunOutcome.SUCCEEDED) {
            jdbc.update(
                """
                    UPDATE progress
                    SET status = 'idle',
                        last_run_at = :now,
                        last_success_at = :now,
                        failure_count = 0,
                        last_error = NULL
                    WHERE job_name = :jobName
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                UPDATE progress
                SET status = 'error',
                    last_run_at = :now
                WHERE job_name = :jobName
                """,
            params
        );
    }

    public void recordFailure(JobName job, String error) {
        jdbc.update(
            """
                UPDATE progress
                SET failure_count = failure_count + 1,
                    last_error = :lastError
                WHERE job_name = :jobName
                """,
            new MapSqlParameterSource()
                .addValue("jobName", job.key())
                .addValue("lastError", truncateError(error))
        );
    }

    public void markCompleted(JobName job, boolean completed) {
        jdbc.update(
            """
                UPDATE progress
                SET completed = :completed
                WHERE job_name = :jobName
                """,
            new MapSqlParameterSource()
                .addValue("jobName", job.key())
                .addValue("completed", completed)
        );
    }

    /**
     * Stores a new configuration fingerprint and forgets the cursor that belonged to the old one.
     */
    public void reconfigure(JobName job, String configKey) {
        jdbc.update(
            """
                UPDATE progress
                SET config_key = :configKey,
                    cursor_value = NULL,
                    completed = FALSE
                WHERE job_name = :jobName
                """,
            new MapSqlParameterSource()
                .addValue("jobName", job.key())
                .addValue("configKey", configKey)
        );
    }

    public void recordCounters(JobName job, long itemsProcessed, long storiesFound) {
        jdbc.update(
            """
                UPDATE progress
                SET items_processed = items_processed + :itemsProcessed,
                    stories_found = stories_found + :storiesFound
                WHERE job_name = :jobName
                """,
            new MapSqlParameterSource()
                .addValue("jobName", job.key())
                .addValue("itemsProcessed", Math.max(0, itemsProcessed))
                .addValue("storiesFound", Math.max(0, storiesFound))
        );
    }

    public int abandonStaleRuns(Instant cutoff, Instant now) {
        return jdbc.update(
            """
                UPDATE progress
                SET status = 'error',
                    last_error = 'aborted_on_startup',
                    last_run_at = :now
                WHERE status = 'running'
                  AND (started_at IS NULL OR started_at < :cutoff)
                """,
            new MapSqlParameterSource()
                .addValue("cutoff", toTimestamp(cutoff))
                .addValue("now", toTimestamp(now))
        );
    }
}
