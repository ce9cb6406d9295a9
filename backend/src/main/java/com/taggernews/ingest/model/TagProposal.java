package com.taggernews.ingest.model;

import java.time.Instant;

public record TagProposal(
    Long id,
    ProposalAction action,
    long tagId,
    String tagName,
    Long targetTagId,
    String targetName,
    String reason,
    int affectedCount,
    ProposalStatus status,
    Instant createdAt,
    Instant appliedAt
) {
    public TagProposal withStatus(ProposalStatus newStatus) {
        return new TagProposal(id, action, tagId, tagName, targetTagId, targetName, reason, affectedCount, newStatus, createdAt, appliedAt);
    }
}
