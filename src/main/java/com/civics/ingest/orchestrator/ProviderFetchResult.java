package com.civics.ingest.orchestrator;

import com.civics.ingest.connector.InvalidRecord;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.SourceRecord;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything one provider worker fetched before it finished, failed or was cancelled.
 *
 * @param completedJurisdictions jurisdictions whose every page was fetched in this run;
 *                               {@link #ALL_JURISDICTIONS} stands for an unrestricted query
 * @param complete               whether every planned jurisdiction completed without a record limit
 * @param cursor                 newest incremental cursor reported by the provider
 */
public record ProviderFetchResult(
        Provider provider,
        List<SourceRecord> records,
        List<InvalidRecord> invalid,
        Set<String> completedJurisdictions,
        boolean complete,
        ProviderOutcome outcome,
        String message,
        String cursor
) {
    public static final String ALL_JURISDICTIONS = "*";

    public ProviderFetchResult {
        Objects.requireNonNull(provider, "provider is required");
        Objects.requireNonNull(outcome, "outcome is required");
        records = List.copyOf(records);
        invalid = List.copyOf(invalid);
        completedJurisdictions = Set.copyOf(completedJurisdictions);
    }

    public static ProviderFetchResult skipped(Provider provider, String message) {
        return new ProviderFetchResult(provider, List.of(), List.of(), Set.of(), false,
                ProviderOutcome.SKIPPED, message, null);
    }

    ProviderFetchResult failed(String message) {
        return new ProviderFetchResult(provider, records, invalid, completedJurisdictions, false,
                ProviderOutcome.FAILED, message, cursor);
    }

    static String label(String jurisdiction) {
        return jurisdiction != null ? jurisdiction : ALL_JURISDICTIONS;
    }

    static String queryJurisdiction(String label) {
        return ALL_JURISDICTIONS.equals(label) ? null : label;
    }
}
