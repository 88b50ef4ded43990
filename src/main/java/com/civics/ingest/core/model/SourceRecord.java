package com.civics.ingest.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One provider's view of one official at one point in time. Immutable.
 *
 * @param source     provider the record came from
 * @param externalId provider-native identifier
 * @param fetchedAt  when the record was fetched
 * @param fields     normalized attributes
 * @param confidence provider-declared or heuristic confidence in [0, 1]
 * @param payloadRef reference to the raw payload for audit, e.g. "federal:/member?offset=250#12"
 */
public record SourceRecord(
        Provider source,
        String externalId,
        Instant fetchedAt,
        SourceFields fields,
        double confidence,
        String payloadRef
) {
    public SourceRecord {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(externalId, "externalId is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        Objects.requireNonNull(fields, "fields is required");
        if (externalId.isBlank()) {
            throw new IllegalArgumentException("externalId must not be blank");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public SourceRecord(Provider source, String externalId, Instant fetchedAt, SourceFields fields) {
        this(source, externalId, fetchedAt, fields, 1.0, null);
    }

    public CrosswalkKey crosswalkKey() {
        return new CrosswalkKey(source, externalId);
    }

    /**
     * Whether the provider reports this official as currently serving. Records from
     * providers that do not say are treated as current.
     */
    public boolean isCurrent() {
        return fields.current() == null || fields.current();
    }
}
