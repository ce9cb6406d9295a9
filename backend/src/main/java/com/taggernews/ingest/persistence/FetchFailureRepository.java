package com.taggernews.ingest.persistence;

import com.taggernews.ingest.model.FetchFailureRecord;
import com.taggernews.ingest.model.JobName;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.taggernews.ingest.persistence.JdbcSupport.toInstant;
import static com.taggernews.ingest.persistence.JdbcSupport.toTimestamp;
import static com.taggernews.ingest.persistence.JdbcSupport.truncateError;

/**
 * Failure ledger: ids skipped after their transient fetch retries ran out.
 */
@Repository
public class FetchFailureRepository {
    private static final RowMapper<FetchFailureRecord> FAILURE_MAPPER = (rs, rowNum) -> new FetchFailureRecord(
        rs.getLong("external_id"),
        JobName.fromKey(rs.getString("job_name")),
        rs.getString("reason"),
        rs.getInt("attempt_count"),
        toInstant(rs.getTimestamp("first_failed_at")),
        toInstant(rs.getTimestamp("last_failed_at")),
        rs.getBoolean("abandoned")
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public FetchFailureRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    /**
     * Adds the id to the ledger or counts one more failed attempt for it.
     *
     * @return the attempt count after this failure
     */
    public int recordFailure(long externalId, JobName job, String reason) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("externalId", externalId)
            .addValue("jobName", job.key())
            .addValue("reason", truncateError(reason))
            .addValue("now", toTimestamp(clock.instant()));
        int updated = incrementAttempt(params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO fetch_failures (
                            external_id, job_name, reason, attempt_count, first_failed_at, last_failed_at, abandoned
                        )
                        VALUES (:externalId, :jobName, :reason, 1, :now, :now, FALSE)
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                incrementAttempt(params);
            }
        }
        return find(externalId).map(FetchFailureRecord::attemptCount).orElse(1);
    }

    private int incrementAttempt(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE fetch_failures
                SET attempt_count = attempt_count + 1,
                    reason = :reason,
                    job_name = :jobName,
                    last_failed_at = :now
                WHERE external_id = :externalId
                """,
            params
        );
    }

    public Optional<FetchFailureRecord> find(long externalId) {
        List<FetchFailureRecord> rows = jdbc.query(
            """
                SELECT external_id, job_name, reason, attempt_count, first_failed_at, last_failed_at, abandoned
                FROM fetch_failures
                WHERE external_id = :externalId
                """,
            new MapSqlParameterSource().addValue("externalId", externalId),
            FAILURE_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<FetchFailureRecord> findRetryable(Instant cutoff, int limit) {
        return jdbc.query(
            """
                SELECT external_id, job_name, reason, attempt_count, first_failed_at, last_failed_at, abandoned
                FROM fetch_failures
                WHERE abandoned = FALSE
                  AND last_failed_at <= :cutoff
                ORDER BY last_failed_at ASC, external_id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("cutoff", toTimestamp(cutoff))
                .addValue("limit", Math.max(1, limit)),
            FAILURE_MAPPER
        );
    }

    public List<FetchFailureRecord> findRecent(boolean includeAbandoned, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        String filter = includeAbandoned ? "" : "WHERE abandoned = FALSE";
        return jdbc.query(
            """
                SELECT external_id, job_name, reason, attempt_count, first_failed_at, last_failed_at, abandoned
                FROM fetch_failures
                %s
                ORDER BY last_failed_at DESC, external_id DESC
                LIMIT :limit
                """.formatted(filter),
            new MapSqlParameterSource().addValue("limit", safeLimit),
            FAILURE_MAPPER
        );
    }

    public void markAbandoned(long externalId) {
        jdbc.update(
            "UPDATE fetch_failures SET abandoned = TRUE WHERE external_id = :externalId",
            new MapSqlParameterSource().addValue("externalId", externalId)
        );
    }

    public void delete(long externalId) {
        jdbc.update(
            "DELETE FROM fetch_failures WHERE external_id = :externalId",
            new MapSqlParameterSource().addValue("externalId", externalId)
        );
    }

    public long countOpen() {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM fetch_failures WHERE abandoned = FALSE",
            new MapSqlParameterSource(),
            Long.class
        );
        return value == null ? 0 : value;
    }
}
