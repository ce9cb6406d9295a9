package com.taggernews.ingest.persistence;

import com.taggernews.ingest.model.ProposalAction;
import com.taggernews.ingest.model.ProposalStatus;
import com.taggernews.ingest.model.TagProposal;
import com.taggernews.ingest.model.TagRecord;
import com.taggernews.ingest.model.TagUsage;
import com.taggernews.ingest.taxonomy.TagTaxonomy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.taggernews.ingest.persistence.JdbcSupport.nullableLong;
import static com.taggernews.ingest.persistence.JdbcSupport.toInstant;
import static com.taggernews.ingest.persistence.JdbcSupport.toTimestamp;

/**
 * Tags, tag usage and taxonomy proposals.
 */
@Repository
public class TagJdbcRepository {
    private static final RowMapper<TagRecord> TAG_MAPPER = (rs, rowNum) -> new TagRecord(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("slug"),
        rs.getInt("level"),
        rs.getString("category"),
        toInstant(rs.getTimestamp("created_at"))
    );

    private static final RowMapper<TagProposal> PROPOSAL_MAPPER = (rs, rowNum) -> new TagProposal(
        rs.getLong("id"),
        ProposalAction.fromDb(rs.getString("action")),
        rs.getLong("tag_id"),
        rs.getString("tag_name"),
        nullableLong(rs, "target_tag_id"),
        rs.getString("target_name"),
        rs.getString("reason"),
        rs.getInt("affected_count"),
        ProposalStatus.fromDb(rs.getString("status")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("applied_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public TagJdbcRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    public Optional<TagRecord> findBySlug(String slug) {
        List<TagRecord> rows = jdbc.query(
            """
                SELECT id, name, slug, level, category, created_at
                FROM tags
                WHERE slug = :slug
                """,
            new MapSqlParameterSource().addValue("slug", slug),
            TAG_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<TagRecord> findById(long id) {
        List<TagRecord> rows = jdbc.query(
            """
                SELECT id, name, slug, level, category, created_at
                FROM tags
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", id),
            TAG_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Returns the tag with the name's slug, creating it when absent. An existing tag keeps its name and level.
     */
    public TagRecord getOrCreate(String name, int level, String category) {
        String trimmed = name == null ? "" : name.trim();
        String slug = TagTaxonomy.slugify(trimmed);
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("tag name has no usable characters: " + name);
        }
        Optional<TagRecord> existing = findBySlug(slug);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            jdbc.update(
                """
                    INSERT INTO tags (name, slug, level, category, created_at)
                    VALUES (:name, :slug, :level, :category, :now)
                    """,
                new MapSqlParameterSource()
                    .addValue("name", trimmed)
                    .addValue("slug", slug)
                    .addValue("level", Math.max(1, Math.min(3, level)))
                    .addValue("category", category)
                    .addValue("now", toTimestamp(clock.instant()))
            );
        } catch (DataIntegrityViolationException ignored) {
            // created concurrently; the lookup below picks it up
        }
        return findBySlug(slug)
            .orElseThrow(() -> new IllegalStateException("Failed to create tag " + slug));
    }

    /**
     * Usage per tag counted over stories whose source timestamp is at or after the cutoff.
     * Tags with no usage in the window are included with a zero count.
     */
    public List<TagUsage> findUsageSince(Instant cutoff) {
        return jdbc.query(
            """
                SELECT t.id, t.name, t.slug, t.level, t.category,
                       COUNT(s.id) AS usage_count
                FROM tags t
                LEFT JOIN story_tags st ON st.tag_id = t.id
                LEFT JOIN stories s ON s.id = st.story_id AND s.source_created_at >= :cutoff
                GROUP BY t.id, t.name, t.slug, t.level, t.category
                ORDER BY t.level, t.name
                """,
            new MapSqlParameterSource().addValue("cutoff", toTimestamp(cutoff)),
            (rs, rowNum) -> new TagUsage(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("slug"),
                rs.getInt("level"),
                rs.getString("category"),
                rs.getLong("usage_count")
            )
        );
    }

    public int countStoriesForTag(long tagId) {
        Integer value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM story_tags WHERE tag_id = :tagId",
            new MapSqlParameterSource().addValue("tagId", tagId),
            Integer.class
        );
        return value == null ? 0 : value;
    }

    public Set<Long> findTagIdsWithPendingProposals() {
        List<Long> ids = jdbc.query(
            """
                SELECT tag_id AS id FROM tag_proposals WHERE status = 'pending-approval'
                UNION
                SELECT target_tag_id AS id FROM tag_proposals
                WHERE status = 'pending-approval' AND target_tag_id IS NOT NULL
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> rs.getLong("id")
        );
        return new HashSet<>(ids);
    }

    public long insertProposal(TagProposal proposal) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO tag_proposals (
                    action, tag_id, tag_name, target_tag_id, target_name, reason,
                    affected_count, status, created_at, applied_at
                )
                VALUES (
                    :action, :tagId, :tagName, :targetTagId, :targetName, :reason,
                    :affectedCount, :status, :createdAt, :appliedAt
                )
                """,
            new MapSqlParameterSource()
                .addValue("action", proposal.action().dbValue())
                .addValue("tagId", proposal.tagId())
                .addValue("tagName", proposal.tagName())
                .addValue("targetTagId", proposal.targetTagId())
                .addValue("targetName", proposal.targetName())
                .addValue("reason", proposal.reason())
                .addValue("affectedCount", proposal.affectedCount())
                .addValue("status", proposal.status().dbValue())
                .addValue("createdAt", toTimestamp(proposal.createdAt() == null ? clock.instant() : proposal.createdAt()))
                .addValue("appliedAt", toTimestamp(proposal.appliedAt())),
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert tag proposal for " + proposal.tagName());
        }
        return key.longValue();
    }

    public List<TagProposal> findProposals(ProposalStatus status, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", safeLimit);
        String filter = "";
        if (status != null) {
            filter = "WHERE status = :status";
            params.addValue("status", status.dbValue());
        }
        return jdbc.query(
            """
                SELECT id, action, tag_id, tag_name, target_tag_id, target_name, reason,
                       affected_count, status, created_at, applied_at
                FROM tag_proposals
                %s
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """.formatted(filter),
            params,
            PROPOSAL_MAPPER
        );
    }

    public long countProposals(ProposalStatus status) {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM tag_proposals WHERE status = :status",
            new MapSqlParameterSource().addValue("status", status.dbValue()),
            Long.class
        );
        return value == null ? 0 : value;
    }

    /**
     * Stores an approved proposal and applies it in one transaction, so a proposal is only
     * recorded as applied together with its effect.
     *
     * @return number of stories linked to the proposal's tag before the change
     */
    @Transactional
    public int recordAndApply(TagProposal proposal) {
        Instant now = clock.instant();
        insertProposal(new TagProposal(
            null,
            proposal.action(),
            proposal.tagId(),
            proposal.tagName(),
            proposal.targetTagId(),
            proposal.targetName(),
            proposal.reason(),
            proposal.affectedCount(),
            proposal.status(),
            proposal.createdAt() == null ? now : proposal.createdAt(),
            now
        ));
        return switch (proposal.action()) {
            case MERGE -> mergeTags(proposal.tagId(), proposal.targetTagId());
            case RENAME -> renameTag(proposal.tagId(), proposal.targetName()) ? countStoriesForTag(proposal.tagId()) : 0;
            case RETIRE -> retireTag(proposal.tagId(), proposal.targetTagId());
        };
    }

    /**
     * Moves every story link of the source tag to the target, skipping stories that already carry the
     * target, then deletes the source tag.
     *
     * @return number of stories that were linked to the source tag
     */
    @Transactional
    public int mergeTags(long sourceTagId, long targetTagId) {
        if (sourceTagId == targetTagId) {
            return 0;
        }
        int affected = countStoriesForTag(sourceTagId);
        repointLinks(sourceTagId, targetTagId);
        deleteTag(sourceTagId);
        return affected;
    }

    public boolean renameTag(long tagId, String newName) {
        int updated = jdbc.update(
            "UPDATE tags SET name = :name WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", tagId)
                .addValue("name", newName.trim())
        );
        return updated == 1;
    }

    /**
     * Removes the tag. Its stories move to {@code replacementTagId} when one is given, otherwise
     * the links are dropped.
     *
     * @return number of stories that lost the tag
     */
    @Transactional
    public int retireTag(long tagId, Long replacementTagId) {
        int affected = countStoriesForTag(tagId);
        if (replacementTagId != null && replacementTagId != tagId) {
            repointLinks(tagId, replacementTagId);
        }
        deleteTag(tagId);
        return affected;
    }

    private void repointLinks(long sourceTagId, long targetTagId) {
        jdbc.update(
            """
                INSERT INTO story_tags (story_id, tag_id)
                SELECT st.story_id, :targetTagId
                FROM story_tags st
                WHERE st.tag_id = :sourceTagId
                  AND NOT EXISTS (
                      SELECT 1 FROM story_tags existing
                      WHERE existing.story_id = st.story_id
                        AND existing.tag_id = :targetTagId
                  )
                """,
            new MapSqlParameterSource()
                .addValue("sourceTagId", sourceTagId)
                .addValue("targetTagId", targetTagId)
        );
    }

    private void deleteTag(long tagId) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("tagId", tagId);
        jdbc.update("DELETE FROM story_tags WHERE tag_id = :tagId", params);
        jdbc.update("DELETE FROM tags WHERE id = :tagId", params);
    }
}
