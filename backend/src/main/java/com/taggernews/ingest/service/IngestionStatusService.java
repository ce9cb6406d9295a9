package com.taggernews.ingest.service;

import com.taggernews.ingest.http.ContentSource;
import com.taggernews.ingest.model.FetchFailureRecord;
import com.taggernews.ingest.model.IngestionStatusResponse;
import com.taggernews.ingest.model.JobName;
import com.taggernews.ingest.model.ProgressRecord;
import com.taggernews.ingest.model.ProposalStatus;
import com.taggernews.ingest.model.StoryRecord;
import com.taggernews.ingest.model.StoryStatus;
import com.taggernews.ingest.model.TagProposal;
import com.taggernews.ingest.persistence.FetchFailureRepository;
import com.taggernews.ingest.persistence.StoryJdbcRepository;
import com.taggernews.ingest.persistence.TagJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@Service
public class IngestionStatusService {
    private static final Logger log = LoggerFactory.getLogger(IngestionStatusService.class);

    private final ProgressStore progressStore;
    private final StoryJdbcRepository storyRepository;
    private final FetchFailureRepository fetchFailureRepository;
    private final TagJdbcRepository tagRepository;
    private final ContentSource contentSource;
    private final Clock clock;

    public IngestionStatusService(
        ProgressStore progressStore,
        StoryJdbcRepository storyRepository,
        FetchFailureRepository fetchFailureRepository,
        TagJdbcRepository tagRepository,
        ContentSource contentSource,
        Clock clock
    ) {
        this.progressStore = progressStore;
        this.storyRepository = storyRepository;
        this.fetchFailureRepository = fetchFailureRepository;
        this.tagRepository = tagRepository;
        this.contentSource = contentSource;
        this.clock = clock;
    }

    public IngestionStatusResponse getStatus() {
        List<ProgressRecord> jobs = progressStore.findAll();
        Map<String, Long> storiesByStatus = storyRepository.countByStatus();
        Long sourceMaxId = null;
        try {
            sourceMaxId = contentSource.maxItemId();
        } catch (RuntimeException e) {
            log.warn("Could not read the source max id for status", e);
        }
        Long continuousGap = null;
        if (sourceMaxId != null) {
            long max = sourceMaxId;
            continuousGap = jobs.stream()
                .filter(job -> job.jobName() == JobName.CONTINUOUS_SYNC && job.cursorValue() != null)
                .map(job -> Math.max(0, max - job.cursorValue()))
                .findFirst()
                .orElse(null);
        }
        return new IngestionStatusResponse(
            clock.instant(),
            jobs,
            storiesByStatus,
            sourceMaxId,
            continuousGap,
            fetchFailureRepository.countOpen(),
            tagRepository.countProposals(ProposalStatus.PENDING_APPROVAL)
        );
    }

    public List<StoryRecord> getFailedStories(int limit) {
        return storyRepository.findByStatus(StoryStatus.FAILED, limit);
    }

    public List<FetchFailureRecord> getFetchFailures(boolean includeAbandoned, int limit) {
        return fetchFailureRepository.findRecent(includeAbandoned, limit);
    }

    public List<TagProposal> getProposals(String status, int limit) {
        ProposalStatus parsed = null;
        if (status != null && !status.isBlank()) {
            try {
                parsed = ProposalStatus.fromDb(status);
            } catch (IllegalArgumentException e) {
                throw new ResponseStatusException(BAD_REQUEST, "Unsupported proposal status: " + status);
            }
        }
        return tagRepository.findProposals(parsed, limit);
    }
}
