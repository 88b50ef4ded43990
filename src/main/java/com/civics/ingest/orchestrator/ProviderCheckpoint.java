package com.civics.ingest.orchestrator;

import com.civics.ingest.core.model.Provider;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Where a provider stopped. A run resumes by skipping the completed jurisdictions and
 * fetching the full set from {@code sinceCursor}.
 *
 * @param completedJurisdictions jurisdictions fully fetched by an unfinished run; empty after a full run
 * @param sinceCursor            incremental cursor of the last full run, may be null
 */
public record ProviderCheckpoint(Provider provider, Set<String> completedJurisdictions, String sinceCursor,
                                 Instant updatedAt) {

    public ProviderCheckpoint {
        Objects.requireNonNull(provider, "provider is required");
        completedJurisdictions = Set.copyOf(completedJurisdictions);
    }

    public static ProviderCheckpoint initial(Provider provider) {
        return new ProviderCheckpoint(provider, Set.of(), null, Instant.EPOCH);
    }

    public boolean isCompleted(String jurisdiction) {
        return completedJurisdictions.contains(jurisdiction);
    }

    /**
     * Checkpoint after an unfinished run: completed jurisdictions accumulate, the cursor stays.
     */
    public ProviderCheckpoint withCompleted(Set<String> jurisdictions, Instant at) {
        Set<String> merged = new TreeSet<>(completedJurisdictions);
        merged.addAll(jurisdictions);
        return new ProviderCheckpoint(provider, merged, sinceCursor, at);
    }

    /**
     * Checkpoint after a full run: nothing left to skip, cursor advanced when the provider reported one.
     */
    public ProviderCheckpoint finished(String cursor, Instant at) {
        return new ProviderCheckpoint(provider, Set.of(), cursor != null ? cursor : sinceCursor, at);
    }
}
