package com.civics.ingest.core.model;

import java.util.Objects;

/**
 * A provider-native identifier, unique within its provider across the whole store.
 */
public record CrosswalkKey(Provider provider, String externalId) {

    public CrosswalkKey {
        Objects.requireNonNull(provider, "provider is required");
        Objects.requireNonNull(externalId, "externalId is required");
        if (externalId.isBlank()) {
            throw new IllegalArgumentException("externalId must not be blank");
        }
    }

    @Override
    public String toString() {
        return provider.key() + ":" + externalId;
    }
}
