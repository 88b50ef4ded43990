package com.civics.ingest.core.model;

public enum VerificationStatus {
    PENDING,
    VERIFIED
}
