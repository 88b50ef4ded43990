package com.civics.ingest.lifecycle;

import com.civics.ingest.core.model.RepresentativeStatus;
import com.civics.ingest.core.model.StatusReason;

import java.util.Objects;

/**
 * One planned status move.
 *
 * @param replacedById successor for replacements, null otherwise
 */
public record StatusTransition(
        String canonicalId,
        RepresentativeStatus from,
        RepresentativeStatus to,
        StatusReason reason,
        String replacedById
) {
    public StatusTransition {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        Objects.requireNonNull(to, "to is required");
        Objects.requireNonNull(reason, "reason is required");
        if (replacedById != null && to != RepresentativeStatus.HISTORICAL) {
            throw new IllegalArgumentException("Only historical transitions carry a successor");
        }
    }

    public static StatusTransition deactivate(String canonicalId) {
        return new StatusTransition(canonicalId, RepresentativeStatus.ACTIVE, RepresentativeStatus.INACTIVE,
                StatusReason.NOT_CURRENT_IN_SOURCE, null);
    }

    public static StatusTransition replace(String canonicalId, String successorId) {
        return new StatusTransition(canonicalId, RepresentativeStatus.ACTIVE, RepresentativeStatus.HISTORICAL,
                StatusReason.REPLACED, successorId);
    }

    public boolean isReplacement() {
        return replacedById != null;
    }
}
