package com.civics.ingest.store;

/**
 * Effect of an idempotent upsert.
 */
public enum UpsertOutcome {
    CREATED,
    UPDATED,
    /** The stored entity already had identical content; nothing was written. */
    UNCHANGED
}
