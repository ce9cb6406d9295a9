package com.taggernews.ingest.api;

import com.taggernews.ingest.error.TransientFetchException;
import com.taggernews.ingest.http.ContentSource;
import com.taggernews.ingest.model.IngestionStatusResponse;
import com.taggernews.ingest.model.JobName;
import com.taggernews.ingest.model.ProposalAction;
import com.taggernews.ingest.model.ProposalStatus;
import com.taggernews.ingest.model.StoryDraft;
import com.taggernews.ingest.model.StoryRecord;
import com.taggernews.ingest.model.TagProposal;
import com.taggernews.ingest.model.TagRecord;
import com.taggernews.ingest.persistence.FetchFailureRepository;
import com.taggernews.ingest.persistence.StoryJdbcRepository;
import com.taggernews.ingest.persistence.TagJdbcRepository;
import com.taggernews.ingest.service.ProgressStore;
import com.taggernews.ingest.util.FetchErrorClassifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JobStatusControllerTest {

    @MockBean
    private ContentSource contentSource;

    @Autowired
    private JobStatusController controller;

    @Autowired
    private ProgressStore progressStore;

    @Autowired
    private StoryJdbcRepository storyRepository;

    @Autowired
    private FetchFailureRepository fetchFailureRepository;

    @Autowired
    private TagJdbcRepository tagRepository;

    @Test
    void statusReportsCursorGapAndCounts() {
        progressStore.resetCursor(JobName.CONTINUOUS_SYNC, 900L);
        when(contentSource.maxItemId()).thenReturn(1_000L);
        storyRepository.upsert(new StoryDraft(3001L, "Pending story", null, 1, "pg", 0, Instant.now()));
        fetchFailureRepository.recordFailure(3002L, JobName.CONTINUOUS_SYNC, "TIMEOUT");

        IngestionStatusResponse status = controller.status();

        assertEquals(1_000L, status.sourceMaxId());
        assertEquals(100L, status.continuousGap());
        assertThat(status.storiesByStatus().get("pending")).isGreaterThanOrEqualTo(1L);
        assertThat(status.openFetchFailures()).isGreaterThanOrEqualTo(1L);
        assertThat(status.jobs()).extracting(job -> job.jobName()).contains(JobName.CONTINUOUS_SYNC);
    }

    @Test
    void statusSurvivesAnUnreachableSource() {
        when(contentSource.maxItemId()).thenThrow(new TransientFetchException(FetchErrorClassifier.TIMEOUT, "timed out"));

        IngestionStatusResponse status = controller.status();

        assertNull(status.sourceMaxId());
        assertNull(status.continuousGap());
    }

    @Test
    void failedStoriesListsOnlyExhaustedStories() {
        StoryRecord story = storyRepository.upsert(new StoryDraft(3003L, "Hopeless", null, 1, "pg", 0, Instant.now())).story();
        storyRepository.markEnrichmentFailed(story.id(), "boom", 1);

        List<StoryRecord> failed = controller.failedStories(50);

        assertThat(failed).extracting(StoryRecord::externalId).contains(3003L);
    }

    @Test
    void proposalsFilterAcceptsUnderscoreSpelling() {
        TagRecord tag = tagRepository.getOrCreate("Needs Review", 3, null);
        tagRepository.insertProposal(new TagProposal(
            null, ProposalAction.RETIRE, tag.id(), tag.name(), null, null,
            "unused", 0, ProposalStatus.PENDING_APPROVAL, null, null
        ));

        List<TagProposal> proposals = controller.proposals("pending_approval", 10);

        assertEquals(1, proposals.size());
        assertEquals("Needs Review", proposals.get(0).tagName());
    }

    @Test
    void unknownProposalStatusIsABadRequest() {
        ResponseStatusException error =
            assertThrows(ResponseStatusException.class, () -> controller.proposals("approved", 10));
        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
    }
}
