package com.civics.ingest.lifecycle;

import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.Provider;

import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * What one current-roster provider reported in a run, after the add step was written.
 *
 * @param currentIds    entities the provider reported as currently serving
 * @param newcomerIds   those of them created this run or whose office slot changed this run
 * @param completeScope whether an entity lies in a jurisdiction whose fetch completed; only
 *                      those entities may be deactivated or replaced
 */
public record RosterSnapshot(
        Provider provider,
        Set<String> currentIds,
        Set<String> newcomerIds,
        Predicate<CanonicalRepresentative> completeScope
) {
    public RosterSnapshot {
        Objects.requireNonNull(provider, "provider is required");
        Objects.requireNonNull(completeScope, "completeScope is required");
        if (!provider.isCurrentRoster()) {
            throw new IllegalArgumentException(provider.key() + " does not publish a current roster");
        }
        currentIds = Set.copyOf(currentIds);
        newcomerIds = Set.copyOf(newcomerIds);
    }
}
