package com.civics.ingest.audit;

/**
 * Auditable actions of the ingestion engine.
 */
public enum AuditAction {
    RUN_STARTED,
    RUN_COMPLETED,
    REPRESENTATIVE_CREATED,
    REPRESENTATIVE_UPDATED,
    STATUS_TRANSITIONED,
    REPLACEMENT_LINKED,
    FUZZY_MATCH_ACCEPTED,
    FUZZY_MATCH_REVERTED,
    POSSIBLE_DUPLICATE_FLAGGED,
    AMBIGUOUS_REPLACEMENT_FLAGGED,
    CROSSWALK_CONFLICT,
    INVALID_RECORD_DROPPED,
    MANUAL_REVIEW_REQUESTED,
    MANUAL_REVIEW_COMPLETED
}
