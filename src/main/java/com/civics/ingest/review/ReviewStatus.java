package com.civics.ingest.review;

public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
