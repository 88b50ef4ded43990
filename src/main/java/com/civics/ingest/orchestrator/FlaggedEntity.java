package com.civics.ingest.orchestrator;

import com.civics.ingest.review.ReviewReason;

import java.util.List;
import java.util.Objects;

/**
 * An edge case a human should look at, listed in the run summary.
 *
 * @param subject      crosswalk key or office slot the flag is about
 * @param canonicalIds entities involved
 * @param score        similarity score for fuzzy flags, 0 otherwise
 */
public record FlaggedEntity(ReviewReason reason, String subject, List<String> canonicalIds, double score,
                            String description) {

    public FlaggedEntity {
        Objects.requireNonNull(reason, "reason is required");
        canonicalIds = List.copyOf(canonicalIds);
    }
}
