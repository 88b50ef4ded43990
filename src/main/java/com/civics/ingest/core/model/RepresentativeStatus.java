package com.civics.ingest.core.model;

/**
 * Lifecycle status of a canonical representative.
 *
 * <p>Allowed moves: ACTIVE to INACTIVE, ACTIVE to HISTORICAL, INACTIVE to HISTORICAL.
 * HISTORICAL is terminal and nothing moves back to ACTIVE.</p>
 */
public enum RepresentativeStatus {
    ACTIVE,
    INACTIVE,
    HISTORICAL;

    public boolean canTransitionTo(RepresentativeStatus target) {
        return switch (this) {
            case ACTIVE -> target == INACTIVE || target == HISTORICAL;
            case INACTIVE -> target == HISTORICAL;
            case HISTORICAL -> false;
        };
    }

    public boolean isTerminal() {
        return this == HISTORICAL;
    }
}
