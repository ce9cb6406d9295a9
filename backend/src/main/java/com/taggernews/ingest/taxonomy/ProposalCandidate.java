package com.taggernews.ingest.taxonomy;

import com.taggernews.ingest.model.ProposalAction;
import com.taggernews.ingest.model.TagUsage;

/**
 * A change suggested by the analyzer before affected counts and approval are decided.
 */
public record ProposalCandidate(
    ProposalAction action,
    TagUsage tag,
    TagUsage target,
    String targetName,
    String reason
) {
}
