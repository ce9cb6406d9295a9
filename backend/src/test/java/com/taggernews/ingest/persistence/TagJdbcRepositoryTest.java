package com.taggernews.ingest.persistence;

import com.taggernews.ingest.model.ProposalAction;
import com.taggernews.ingest.model.ProposalStatus;
import com.taggernews.ingest.model.StoryDraft;
import com.taggernews.ingest.model.StoryRecord;
import com.taggernews.ingest.model.TagProposal;
import com.taggernews.ingest.model.TagRecord;
import com.taggernews.ingest.model.TagUsage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class TagJdbcRepositoryTest {

    @Autowired
    private TagJdbcRepository tagRepository;

    @Autowired
    private StoryJdbcRepository storyRepository;

    @Test
    void getOrCreateIsKeyedBySlug() {
        TagRecord first = tagRepository.getOrCreate("Machine Learning", 2, "Tech Topics");
        TagRecord second = tagRepository.getOrCreate("  machine-learning ", 3, null);

        assertEquals(first.id(), second.id());
        assertEquals("Machine Learning", second.name());
        assertEquals(2, second.level());
        assertEquals("machine-learning", second.slug());
    }

    @Test
    void levelOneTagsAreSeeded() {
        assertTrue(tagRepository.findBySlug("tech").isPresent());
        assertTrue(tagRepository.findBySlug("science").isPresent());
    }

    @Test
    void nameWithoutUsableCharactersIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> tagRepository.getOrCreate("!!!", 3, null));
    }

    @Test
    void usageCountsOnlyStoriesInsideTheWindow() {
        TagRecord tag = tagRepository.getOrCreate("Windowed", 3, null);
        Instant now = Instant.now();
        StoryRecord recent = story(7001L, now.minus(1, ChronoUnit.DAYS));
        StoryRecord old = story(7002L, now.minus(60, ChronoUnit.DAYS));
        storyRepository.applyEnrichment(recent.id(), "s", "m", List.of(tag.id()));
        storyRepository.applyEnrichment(old.id(), "s", "m", List.of(tag.id()));

        List<TagUsage> usage = tagRepository.findUsageSince(now.minus(30, ChronoUnit.DAYS));

        TagUsage windowed = usage.stream().filter(u -> u.tagId() == tag.id()).findFirst().orElseThrow();
        assertEquals(1L, windowed.usageCount());
        assertEquals(2, tagRepository.countStoriesForTag(tag.id()));
    }

    @Test
    void mergeMovesLinksWithoutDuplicates() {
        TagRecord source = tagRepository.getOrCreate("Javascript Frameworks", 3, null);
        TagRecord target = tagRepository.getOrCreate("JavaScript", 2, "Tech Stacks");
        StoryRecord both = story(7101L, Instant.now());
        StoryRecord sourceOnly = story(7102L, Instant.now());
        storyRepository.applyEnrichment(both.id(), "s", "m", List.of(source.id(), target.id()));
        storyRepository.applyEnrichment(sourceOnly.id(), "s", "m", List.of(source.id()));

        int affected = tagRepository.mergeTags(source.id(), target.id());

        assertEquals(2, affected);
        assertEquals(List.of(target.id()), storyRepository.findTagIds(both.id()));
        assertEquals(List.of(target.id()), storyRepository.findTagIds(sourceOnly.id()));
        assertTrue(tagRepository.findById(source.id()).isEmpty());
        assertEquals(2, tagRepository.countStoriesForTag(target.id()));
    }

    @Test
    void retireRemovesTagAndLinks() {
        TagRecord tag = tagRepository.getOrCreate("Short Lived", 3, null);
        StoryRecord story = story(7201L, Instant.now());
        storyRepository.applyEnrichment(story.id(), "s", "m", List.of(tag.id()));

        assertEquals(1, tagRepository.retireTag(tag.id(), null));
        assertTrue(tagRepository.findById(tag.id()).isEmpty());
        assertThat(storyRepository.findTagIds(story.id())).isEmpty();
    }

    @Test
    void retireWithReplacementMovesStoriesWithoutDuplicates() {
        TagRecord tech = tagRepository.findBySlug("tech").orElseThrow();
        TagRecord rare = tagRepository.getOrCreate("Zig", 2, "Tech Stacks");
        StoryRecord both = story(7301L, Instant.now());
        StoryRecord rareOnly = story(7302L, Instant.now());
        storyRepository.applyEnrichment(both.id(), "s", "m", List.of(tech.id(), rare.id()));
        storyRepository.applyEnrichment(rareOnly.id(), "s", "m", List.of(rare.id()));

        assertEquals(2, tagRepository.retireTag(rare.id(), tech.id()));

        assertTrue(tagRepository.findById(rare.id()).isEmpty());
        assertEquals(List.of(tech.id()), storyRepository.findTagIds(both.id()));
        assertEquals(List.of(tech.id()), storyRepository.findTagIds(rareOnly.id()));
    }

    @Test
    void renameKeepsIdentity() {
        TagRecord tag = tagRepository.getOrCreate("golang", 3, null);

        assertTrue(tagRepository.renameTag(tag.id(), "Go"));
        assertEquals("Go", tagRepository.findById(tag.id()).orElseThrow().name());
    }

    @Test
    void pendingProposalsBlockBothTags() {
        TagRecord source = tagRepository.getOrCreate("Blocked Source", 3, null);
        TagRecord target = tagRepository.getOrCreate("Blocked Target", 3, null);
        TagRecord other = tagRepository.getOrCreate("Auto Approved Tag", 3, null);

        long pendingId = tagRepository.insertProposal(new TagProposal(
            null, ProposalAction.MERGE, source.id(), source.name(), target.id(), target.name(),
            "similar", 1, ProposalStatus.PENDING_APPROVAL, null, null
        ));
        tagRepository.insertProposal(new TagProposal(
            null, ProposalAction.RETIRE, other.id(), other.name(), null, null,
            "unused", 0, ProposalStatus.AUTO_APPROVED, null, null
        ));

        assertThat(tagRepository.findTagIdsWithPendingProposals())
            .contains(source.id(), target.id())
            .doesNotContain(other.id());
        assertEquals(1, tagRepository.countProposals(ProposalStatus.PENDING_APPROVAL));

        List<TagProposal> pending = tagRepository.findProposals(ProposalStatus.PENDING_APPROVAL, 10);
        assertEquals(1, pending.size());
        assertEquals(pendingId, pending.get(0).id());
        assertEquals(target.id(), pending.get(0).targetTagId());
        assertEquals(2, tagRepository.findProposals(null, 10).size());
    }

    @Test
    void recordAndApplyStoresAppliedProposalWithItsEffect() {
        TagRecord tag = tagRepository.getOrCreate("Applied", 3, null);
        StoryRecord story = story(7401L, Instant.now());
        storyRepository.applyEnrichment(story.id(), "s", "m", List.of(tag.id()));

        int affected = tagRepository.recordAndApply(new TagProposal(
            null, ProposalAction.RETIRE, tag.id(), tag.name(), null, null,
            "unused", 1, ProposalStatus.AUTO_APPROVED, null, null
        ));

        assertEquals(1, affected);
        assertTrue(tagRepository.findById(tag.id()).isEmpty());
        TagProposal applied = tagRepository.findProposals(ProposalStatus.AUTO_APPROVED, 10).get(0);
        assertEquals(tag.id(), applied.tagId());
        assertThat(applied.appliedAt()).isNotNull();
        assertThat(applied.targetTagId()).isNull();
    }

    private StoryRecord story(long externalId, Instant createdAt) {
        return storyRepository.upsert(
            new StoryDraft(externalId, "Story " + externalId, null, 1, "pg", 0, createdAt)
        ).story();
    }
}
