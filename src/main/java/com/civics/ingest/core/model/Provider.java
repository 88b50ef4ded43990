package com.civics.ingest.core.model;

import java.util.Arrays;

/**
 * Upstream data providers an ingest run can pull from.
 *
 * <p>Declaration order is the final tie-break when two providers report the same field
 * with equal precedence and identical fetch times, so it must stay stable.</p>
 */
public enum Provider {

    FEDERAL_ROSTER("federal", true, false, true),
    STATE_LEGISLATURE("state", true, false, false),
    CIVIC_LOOKUP("civic", true, false, true),
    CAMPAIGN_FINANCE("finance", false, true, false);

    private final String key;
    private final boolean currentRoster;
    private final boolean enrichmentOnly;
    private final boolean currentOnlyQueries;

    Provider(String key, boolean currentRoster, boolean enrichmentOnly, boolean currentOnlyQueries) {
        this.key = key;
        this.currentRoster = currentRoster;
        this.enrichmentOnly = enrichmentOnly;
        this.currentOnlyQueries = currentOnlyQueries;
    }

    /**
     * Short key used in crosswalk maps, configuration property names and logs.
     */
    public String key() {
        return key;
    }

    /**
     * Whether this provider publishes an authoritative list of currently serving officials.
     * Only roster providers drive deactivation and replacement detection.
     */
    public boolean isCurrentRoster() {
        return currentRoster;
    }

    /**
     * Whether this provider only adds secondary data and is skipped by first-time runs.
     */
    public boolean isEnrichmentOnly() {
        return enrichmentOnly;
    }

    /**
     * Whether the upstream API can be asked for current officials only.
     */
    public boolean supportsCurrentOnlyQueries() {
        return currentOnlyQueries;
    }

    /**
     * Whether values from this provider count as government-sourced.
     */
    public boolean isGovernmentSource() {
        return this == FEDERAL_ROSTER || this == STATE_LEGISLATURE;
    }

    public static Provider fromKey(String key) {
        return Arrays.stream(values())
                .filter(p -> p.key.equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + key));
    }
}
