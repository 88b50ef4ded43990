package com.civics.ingest.resolve;

import com.civics.ingest.core.model.SourceRecord;

import java.util.Objects;

/**
 * A source record paired with the canonical entity it belongs to.
 *
 * <p>For {@link ResolutionDecision#mintsEntity() minting} decisions the id is freshly
 * generated and shared by every record of the batch group, so the records of one new
 * official merge into one entity.</p>
 *
 * @param predecessorId for REACTIVATION, the non-active entity that held the key
 * @param fuzzyMatch    for FUZZY_MATCH, the ledger entry to record
 */
public record ResolvedRecord(
        SourceRecord record,
        String canonicalId,
        ResolutionDecision decision,
        double score,
        String predecessorId,
        FuzzyMatchRecord fuzzyMatch
) {
    public ResolvedRecord {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        Objects.requireNonNull(decision, "decision is required");
    }

    public boolean isNew() {
        return decision.mintsEntity();
    }
}
