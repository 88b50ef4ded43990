package com.civics.ingest.review;

/**
 * Undoes an automatically accepted fuzzy match when a reviewer rejects it.
 */
@FunctionalInterface
public interface FuzzyMatchReverter {

    /**
     * @param fuzzyMatchId the ledger id carried as the review item's reference
     * @param reviewerId   who rejected the match
     */
    void revert(String fuzzyMatchId, String reviewerId);
}
