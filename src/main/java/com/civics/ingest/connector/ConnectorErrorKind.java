package com.civics.ingest.connector;

/**
 * Typed failure of a connector call.
 */
public enum ConnectorErrorKind {
    /** Provider signalled too many requests; retry after backoff. */
    RATE_LIMITED,
    /** Network failure or 5xx; retry with exponential backoff up to the attempt ceiling. */
    TRANSIENT,
    /** Malformed or rejected payload; never retried. */
    INVALID,
    /** Quota for the current window is used up; the provider stops for this run. */
    EXHAUSTED;

    public boolean isRetryable() {
        return this == RATE_LIMITED || this == TRANSIENT;
    }
}
