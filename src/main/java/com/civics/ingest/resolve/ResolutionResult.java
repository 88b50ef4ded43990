package com.civics.ingest.resolve;

import com.civics.ingest.core.model.SourceRecord;
import com.civics.ingest.review.ReviewItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one {@link CanonicalResolver#resolveBatch} call.
 *
 * @param resolved    records assigned to a canonical id
 * @param unmatched   records that match nothing and may not mint an entity, e.g. finance
 *                    records or non-current roster entries
 * @param conflicted  records whose keys point at more than one active entity
 * @param reviewItems review items to queue (fuzzy matches, possible duplicates, conflicts)
 */
public record ResolutionResult(
        List<ResolvedRecord> resolved,
        List<SourceRecord> unmatched,
        List<SourceRecord> conflicted,
        List<ReviewItem> reviewItems
) {
    public ResolutionResult {
        resolved = List.copyOf(resolved);
        unmatched = List.copyOf(unmatched);
        conflicted = List.copyOf(conflicted);
        reviewItems = List.copyOf(reviewItems);
    }

    /**
     * Resolved records grouped by canonical id, in first-seen order.
     */
    public Map<String, List<ResolvedRecord>> byCanonicalId() {
        Map<String, List<ResolvedRecord>> grouped = new LinkedHashMap<>();
        for (ResolvedRecord r : resolved) {
            grouped.computeIfAbsent(r.canonicalId(), k -> new ArrayList<>()).add(r);
        }
        return grouped;
    }
}
