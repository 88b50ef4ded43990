package com.civics.ingest.resolve;

/**
 * How a source record was assigned to a canonical entity.
 */
public enum ResolutionDecision {
    /** The record's own crosswalk key is held by the entity. */
    EXACT,
    /** A cross reference carried by the record, or by a record in its batch group, is held by the entity. */
    EXACT_CROSS_REFERENCE,
    /** Above the accept threshold against exactly one candidate. Ledgered and reversible. */
    FUZZY_MATCH,
    /** No match; a new entity is minted. */
    NEW,
    /** A returning official: the key belongs to a non-active entity, so a new entity is minted. */
    REACTIVATION;

    public boolean mintsEntity() {
        return this == NEW || this == REACTIVATION;
    }
}
