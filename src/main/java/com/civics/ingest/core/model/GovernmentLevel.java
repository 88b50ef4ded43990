package com.civics.ingest.core.model;

/**
 * Level of government an office belongs to.
 */
public enum GovernmentLevel {
    FEDERAL,
    STATE,
    LOCAL
}
