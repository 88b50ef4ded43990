package com.civics.ingest.orchestrator;

import com.civics.ingest.connector.ConnectorErrorKind;

/**
 * How one provider's fetch ended, as reported in the run summary.
 */
public enum ProviderOutcome {
    COMPLETED,
    /** Stopped early by the run deadline or the record limit. */
    PARTIAL,
    /** Quota exhausted. Not an error: entities of this provider are left untouched. */
    EXHAUSTED,
    /** Rate-limit retries ran out. */
    RATE_LIMITED,
    /** Transient or invalid failures ran out the retry budget. */
    FAILED,
    /** Not fetched in this mode, e.g. enrichment-only providers on a first-time run. */
    SKIPPED;

    static ProviderOutcome fromSignal(ConnectorErrorKind kind) {
        return switch (kind) {
            case EXHAUSTED -> EXHAUSTED;
            case RATE_LIMITED -> RATE_LIMITED;
            case TRANSIENT, INVALID -> FAILED;
        };
    }

    public boolean isError() {
        return this == RATE_LIMITED || this == FAILED;
    }
}
