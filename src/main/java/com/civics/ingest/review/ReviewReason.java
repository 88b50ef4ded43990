package com.civics.ingest.review;

/**
 * Why an item needs a human decision.
 */
public enum ReviewReason {
    /** A fuzzy match was accepted automatically and can be reverted. */
    FUZZY_MATCH,
    /** A new entity was created that resembles an existing one. */
    POSSIBLE_DUPLICATE,
    /** Two or more current records claim the same office slot. */
    AMBIGUOUS_REPLACEMENT,
    /** A write was rejected because the crosswalk key belongs to another entity. */
    CROSSWALK_CONFLICT
}
