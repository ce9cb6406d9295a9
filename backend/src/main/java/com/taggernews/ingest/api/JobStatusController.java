package com.taggernews.ingest.api;

import com.taggernews.ingest.model.FetchFailureRecord;
import com.taggernews.ingest.model.IngestionStatusResponse;
import com.taggernews.ingest.model.StoryRecord;
import com.taggernews.ingest.model.TagProposal;
import com.taggernews.ingest.service.IngestionStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/ingest")
public class JobStatusController {
    private final IngestionStatusService statusService;

    public JobStatusController(IngestionStatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping("/status")
    public IngestionStatusResponse status() {
        return statusService.getStatus();
    }

    @GetMapping("/failed-stories")
    public List<StoryRecord> failedStories(
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        return statusService.getFailedStories(limit);
    }

    @GetMapping("/fetch-failures")
    public List<FetchFailureRecord> fetchFailures(
        @RequestParam(name = "includeAbandoned", required = false, defaultValue = "true") boolean includeAbandoned,
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        return statusService.getFetchFailures(includeAbandoned, limit);
    }

    @GetMapping("/proposals")
    public List<TagProposal> proposals(
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        return statusService.getProposals(status, limit);
    }
}
