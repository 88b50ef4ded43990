package com.civics.ingest.orchestrator;

/**
 * How a run treats its providers.
 */
public enum IngestMode {

    /** Seed run: current officials only, enrichment-only providers skipped, no lifecycle step. */
    FIRST_TIME("first_time"),

    /** Add, then deactivate and replace, then enrich. */
    ENRICHMENT("enrichment");

    private final String code;

    IngestMode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
