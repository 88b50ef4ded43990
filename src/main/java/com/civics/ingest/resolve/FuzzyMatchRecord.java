package com.civics.ingest.resolve;

import com.civics.ingest.core.model.CrosswalkKey;
import com.civics.ingest.similarity.SimilarityBreakdown;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One accepted fuzzy match: provider keys were attached to an existing entity on
 * similarity alone.
 *
 * @param keys       the crosswalk keys attached by the match
 * @param subject    display form of the matched record, for reviewers
 * @param revertedBy reviewer who rejected the match, null while the match stands
 */
public record FuzzyMatchRecord(
        String id,
        List<CrosswalkKey> keys,
        String subject,
        String canonicalId,
        SimilarityBreakdown breakdown,
        String runId,
        Instant decidedAt,
        String revertedBy,
        Instant revertedAt
) {
    public FuzzyMatchRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(keys, "keys are required");
        keys = List.copyOf(keys);
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        Objects.requireNonNull(decidedAt, "decidedAt is required");
    }

    public boolean isReverted() {
        return revertedBy != null;
    }

    FuzzyMatchRecord reverted(String reviewerId, Instant at) {
        return new FuzzyMatchRecord(id, keys, subject, canonicalId, breakdown, runId, decidedAt, reviewerId, at);
    }
}
