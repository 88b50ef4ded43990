package com.civics.ingest.connector;

/**
 * A raw item that could not be mapped to a source record.
 *
 * @param payloadRef reference to the raw item for audit
 * @param reason     why the mapping failed
 */
public record InvalidRecord(String payloadRef, String reason) {
}
