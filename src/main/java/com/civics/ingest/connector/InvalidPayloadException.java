package com.civics.ingest.connector;

/**
 * Thrown by {@link SourceConnector#mapToIntermediate} when a raw item violates the
 * provider schema. The item is dropped and logged, never retried.
 */
public class InvalidPayloadException extends Exception {

    public InvalidPayloadException(String message) {
        super(message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
