package com.civics.ingest.rules;

/**
 * What kind of value a normalization rule is written for.
 */
public enum RuleScope {
    PERSON_NAME,
    OFFICE_TITLE
}
