package com.civics.ingest.core.model;

/**
 * Groups displayed fields by the precedence table that governs them during reconciliation.
 */
public enum FieldCategory {
    IDENTITY,
    TERM,
    AFFILIATION,
    FINANCIAL,
    CONTACT
}
