package com.civics.ingest.core.model;

import java.time.LocalDate;

/**
 * Every displayed field of a representative, with the category that decides which
 * provider wins it and the Java type its values must have.
 */
public enum FieldKey {

    NAME(FieldCategory.IDENTITY, NameParts.class, true),
    LEVEL(FieldCategory.IDENTITY, GovernmentLevel.class, true),
    OFFICE(FieldCategory.IDENTITY, String.class, true),
    JURISDICTION(FieldCategory.IDENTITY, String.class, true),
    DISTRICT(FieldCategory.IDENTITY, String.class, true),
    WIKIPEDIA_URL(FieldCategory.IDENTITY, String.class, false),
    BALLOTPEDIA_URL(FieldCategory.IDENTITY, String.class, false),
    GOVTRACK_ID(FieldCategory.IDENTITY, String.class, false),

    TERM_START(FieldCategory.TERM, LocalDate.class, false),
    TERM_END(FieldCategory.TERM, LocalDate.class, false),
    STATUS_HINT(FieldCategory.TERM, StatusReason.class, false),

    PARTY(FieldCategory.AFFILIATION, String.class, false),

    FINANCE(FieldCategory.FINANCIAL, FinanceSummary.class, false),

    EMAIL(FieldCategory.CONTACT, String.class, false),
    PHONE(FieldCategory.CONTACT, String.class, false),
    WEBSITE(FieldCategory.CONTACT, String.class, false),
    PHOTO_URL(FieldCategory.CONTACT, String.class, false),
    OFFICE_ADDRESS(FieldCategory.CONTACT, String.class, false),
    TWITTER(FieldCategory.CONTACT, String.class, false),
    FACEBOOK(FieldCategory.CONTACT, String.class, false),
    YOUTUBE(FieldCategory.CONTACT, String.class, false),
    INSTAGRAM(FieldCategory.CONTACT, String.class, false);

    private final FieldCategory category;
    private final Class<?> valueType;
    private final boolean slotDefining;

    FieldKey(FieldCategory category, Class<?> valueType, boolean slotDefining) {
        this.category = category;
        this.valueType = valueType;
        this.slotDefining = slotDefining;
    }

    public FieldCategory category() {
        return category;
    }

    public Class<?> valueType() {
        return valueType;
    }

    /**
     * Whether the field participates in identity or office-slot derivation.
     */
    public boolean isSlotDefining() {
        return slotDefining;
    }

    /**
     * Verifies that {@code value} has this field's type.
     *
     * @throws IllegalArgumentException on a type mismatch
     */
    public Object checkValue(Object value) {
        if (value != null && !valueType.isInstance(value)) {
            throw new IllegalArgumentException("Field " + name() + " expects " + valueType.getSimpleName()
                    + " but got " + value.getClass().getSimpleName());
        }
        return value;
    }
}
