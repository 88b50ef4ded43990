package com.civics.ingest.lifecycle;

import com.civics.ingest.core.model.RepresentativeStatus;

/**
 * Thrown for a status move the lifecycle state machine does not allow, such as any move
 * out of HISTORICAL or back to ACTIVE.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String canonicalId;
    private final RepresentativeStatus from;
    private final RepresentativeStatus to;

    public InvalidTransitionException(String canonicalId, RepresentativeStatus from, RepresentativeStatus to) {
        super("Illegal status transition " + from + " -> " + to + " for " + canonicalId);
        this.canonicalId = canonicalId;
        this.from = from;
        this.to = to;
    }

    public String getCanonicalId() {
        return canonicalId;
    }

    public RepresentativeStatus getFrom() {
        return from;
    }

    public RepresentativeStatus getTo() {
        return to;
    }
}
