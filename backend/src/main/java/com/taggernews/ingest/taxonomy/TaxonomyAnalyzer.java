package com.taggernews.ingest.taxonomy;

import com.taggernews.ingest.model.ProposalAction;
import com.taggernews.ingest.model.TagUsage;
import com.taggernews.ingest.util.TagSimilarity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds near-duplicate, misspelled and underused tags in a usage snapshot.
 * Level 1 tags are canonical and never proposed.
 */
@Component
public class TaxonomyAnalyzer {
    public static final double MERGE_SIMILARITY_THRESHOLD = 0.85;

    /**
     * Proposals are capped at {@code maxProposals}, filled with merges first, then renames, then retires.
     * A tag appears in at most one proposal, and tags in {@code excludedTagIds} are left alone.
     */
    public List<ProposalCandidate> analyze(
        List<TagUsage> usage,
        Set<Long> excludedTagIds,
        int minTagUsage,
        int maxProposals
    ) {
        List<TagUsage> candidates = usage.stream()
            .filter(tag -> tag.level() >= 2)
            .filter(tag -> !excludedTagIds.contains(tag.tagId()))
            .sorted(Comparator.comparing(TagUsage::name, String.CASE_INSENSITIVE_ORDER).thenComparingLong(TagUsage::tagId))
            .toList();

        Map<String, TagUsage> levelOneBySlug = new HashMap<>();
        for (TagUsage tag : usage) {
            if (tag.level() == 1) {
                levelOneBySlug.putIfAbsent(tag.slug(), tag);
            }
        }

        List<ProposalCandidate> proposals = new ArrayList<>();
        Set<Long> named = new HashSet<>();

        for (ScoredPair pair : similarPairs(candidates)) {
            if (proposals.size() >= maxProposals) {
                return proposals;
            }
            if (named.contains(pair.source().tagId()) || named.contains(pair.target().tagId())) {
                continue;
            }
            named.add(pair.source().tagId());
            named.add(pair.target().tagId());
            proposals.add(new ProposalCandidate(
                ProposalAction.MERGE,
                pair.source(),
                pair.target(),
                pair.target().name(),
                String.format(
                    Locale.ROOT,
                    "'%s' is %.0f%% similar to '%s' (%d vs %d recent uses)",
                    pair.source().name(),
                    pair.similarity() * 100,
                    pair.target().name(),
                    pair.source().usageCount(),
                    pair.target().usageCount()
                )
            ));
        }

        for (TagUsage tag : candidates) {
            if (proposals.size() >= maxProposals) {
                return proposals;
            }
            if (named.contains(tag.tagId())) {
                continue;
            }
            Optional<String> canonical = TagTaxonomy.canonicalName(tag.name());
            if (canonical.isPresent() && !canonical.get().equals(tag.name())) {
                named.add(tag.tagId());
                proposals.add(new ProposalCandidate(
                    ProposalAction.RENAME,
                    tag,
                    null,
                    canonical.get(),
                    "'" + tag.name() + "' is a variant of the canonical name '" + canonical.get() + "'"
                ));
            }
        }

        List<TagUsage> sparse = candidates.stream()
            .filter(tag -> tag.usageCount() < minTagUsage)
            .sorted(Comparator.comparingInt(TagUsage::level)
                .thenComparingLong(TagUsage::usageCount)
                .thenComparing(TagUsage::name, String.CASE_INSENSITIVE_ORDER))
            .toList();
        for (TagUsage tag : sparse) {
            if (proposals.size() >= maxProposals) {
                return proposals;
            }
            if (named.contains(tag.tagId())) {
                continue;
            }
            named.add(tag.tagId());
            TagUsage parent = levelOneParent(tag, levelOneBySlug).orElse(null);
            String reason = "used " + tag.usageCount() + " time(s) in the window, below the minimum of " + minTagUsage;
            proposals.add(new ProposalCandidate(
                ProposalAction.RETIRE,
                tag,
                parent,
                parent == null ? null : parent.name(),
                parent == null ? reason : reason + "; stories fall back to '" + parent.name() + "'"
            ));
        }
        return proposals;
    }

    private Optional<TagUsage> levelOneParent(TagUsage tag, Map<String, TagUsage> levelOneBySlug) {
        String category = tag.category() == null || tag.category().isBlank()
            ? TagTaxonomy.categoryOf(tag.name()).orElse(null)
            : tag.category();
        return TagTaxonomy.levelOneParentOf(category)
            .map(parent -> levelOneBySlug.get(TagTaxonomy.slugify(parent)));
    }

    private List<ScoredPair> similarPairs(List<TagUsage> candidates) {
        List<ScoredPair> pairs = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                TagUsage left = candidates.get(i);
                TagUsage right = candidates.get(j);
                double similarity = TagSimilarity.ratio(left.name(), right.name());
                if (similarity <= MERGE_SIMILARITY_THRESHOLD) {
                    continue;
                }
                boolean leftIsTarget = left.usageCount() > right.usageCount()
                    || (left.usageCount() == right.usageCount() && left.tagId() < right.tagId());
                TagUsage target = leftIsTarget ? left : right;
                TagUsage source = leftIsTarget ? right : left;
                pairs.add(new ScoredPair(source, target, similarity));
            }
        }
        pairs.sort(Comparator.comparingDouble(ScoredPair::similarity).reversed()
            .thenComparingLong(pair -> pair.source().tagId()));
        return pairs;
    }

    private record ScoredPair(TagUsage source, TagUsage target, double similarity) {
    }
}
