package com.civics.ingest.lock;

/**
 * Thrown when an entity lock cannot be acquired within the configured timeout.
 * Counted as a record-level error by the orchestrator.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
