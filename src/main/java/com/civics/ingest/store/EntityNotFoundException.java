package com.civics.ingest.store;

public class EntityNotFoundException extends RuntimeException {

    private final String canonicalId;

    public EntityNotFoundException(String canonicalId) {
        super("Canonical representative not found: " + canonicalId);
        this.canonicalId = canonicalId;
    }

    public String getCanonicalId() {
        return canonicalId;
    }
}
