package com.taggernews.ingest.taxonomy;

import com.taggernews.config.IngestionProperties;
import com.taggernews.ingest.model.JobName;
import com.taggernews.ingest.model.JobRunSummary;
import com.taggernews.ingest.model.ProposalAction;
import com.taggernews.ingest.model.ProposalStatus;
import com.taggernews.ingest.model.TagProposal;
import com.taggernews.ingest.model.TagUsage;
import com.taggernews.ingest.persistence.TagJdbcRepository;
import com.taggernews.ingest.service.ScheduledJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Periodic tag health check. Stores merge, rename and retire proposals and applies the low-risk ones
 * when auto-approval is on. Story enrichment status is never touched.
 */
@Component
public class TaxonomyAgentJob implements ScheduledJob {
    private static final Logger log = LoggerFactory.getLogger(TaxonomyAgentJob.class);

    private final TagJdbcRepository tagRepository;
    private final TaxonomyAnalyzer analyzer;
    private final IngestionProperties properties;
    private final Clock clock;

    public TaxonomyAgentJob(
        TagJdbcRepository tagRepository,
        TaxonomyAnalyzer analyzer,
        IngestionProperties properties,
        Clock clock
    ) {
        this.tagRepository = tagRepository;
        this.analyzer = analyzer;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public JobName name() {
        return JobName.TAXONOMY_AGENT;
    }

    @Override
    public Duration interval() {
        return properties.getAgent().getInterval();
    }

    @Override
    public JobRunSummary run() {
        IngestionProperties.Agent config = properties.getAgent();
        Instant now = clock.instant();
        Instant windowStart = now.minus(Duration.ofDays(config.getWindowDays()));
        List<TagUsage> usage = tagRepository.findUsageSince(windowStart);
        Set<Long> awaitingApproval = tagRepository.findTagIdsWithPendingProposals();

        List<ProposalCandidate> candidates = analyzer.analyze(
            usage,
            awaitingApproval,
            config.getMinTagUsage(),
            config.getMaxProposals()
        );

        int applied = 0;
        int pendingApproval = 0;
        for (ProposalCandidate candidate : candidates) {
            int affected = tagRepository.countStoriesForTag(candidate.tag().tagId());
            boolean autoApprove = isAutoApprovable(candidate.action(), affected, config);
            TagProposal proposal = new TagProposal(
                null,
                candidate.action(),
                candidate.tag().tagId(),
                candidate.tag().name(),
                candidate.target() == null ? null : candidate.target().tagId(),
                candidate.targetName(),
                candidate.reason(),
                affected,
                autoApprove ? ProposalStatus.AUTO_APPROVED : ProposalStatus.PENDING_APPROVAL,
                now,
                null
            );
            if (autoApprove) {
                int changed = tagRepository.recordAndApply(proposal);
                log.info("Applied {} of tag '{}'{} ({} stories)",
                    proposal.action().dbValue(),
                    proposal.tagName(),
                    proposal.targetName() == null ? "" : " -> '" + proposal.targetName() + "'",
                    changed
                );
                applied++;
            } else {
                tagRepository.insertProposal(proposal);
                pendingApproval++;
            }
        }

        log.info(
            "Taxonomy agent analysed {} tags over {} days: {} proposal(s), {} auto-applied, {} awaiting approval",
            usage.size(),
            config.getWindowDays(),
            candidates.size(),
            applied,
            pendingApproval
        );
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tagsAnalysed", usage.size());
        details.put("proposals", candidates.size());
        details.put("autoApplied", applied);
        details.put("pendingApproval", pendingApproval);
        return new JobRunSummary(name(), usage.size(), 0, details);
    }

    /**
     * Renames always wait for a person; merges and retires qualify when few stories are affected.
     */
    boolean isAutoApprovable(ProposalAction action, int affected, IngestionProperties.Agent config) {
        if (!config.isAutoApprove() || action == ProposalAction.RENAME) {
            return false;
        }
        return affected <= config.getAutoApproveMaxAffected();
    }
}
