package com.civics.ingest.orchestrator;

public enum RunStatus {
    RUNNING,
    /** Every provider fetched everything it was asked for. */
    COMPLETED,
    /** Deadline, quota exhaustion or a provider failure left some data unfetched; checkpoints were kept. */
    PARTIAL,
    /** The store could not be written. */
    FAILED
}
