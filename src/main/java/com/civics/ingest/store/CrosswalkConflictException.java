package com.civics.ingest.store;

import com.civics.ingest.core.model.CrosswalkKey;

/**
 * Raised when a write would give a crosswalk key to a second canonical entity.
 * Never retried; the write is dropped and reported as a data-integrity incident.
 */
public class CrosswalkConflictException extends RuntimeException {

    private final CrosswalkKey key;
    private final String ownerId;
    private final String claimantId;

    public CrosswalkConflictException(CrosswalkKey key, String ownerId, String claimantId) {
        super("Crosswalk key " + key + " belongs to " + ownerId + ", rejected for " + claimantId);
        this.key = key;
        this.ownerId = ownerId;
        this.claimantId = claimantId;
    }

    public CrosswalkKey getKey() {
        return key;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getClaimantId() {
        return claimantId;
    }
}
