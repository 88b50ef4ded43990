package com.civics.ingest.core.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized attribute bag of one source record. Every field is optional.
 *
 * <p>Values are type-checked against {@link FieldKey#valueType()} on entry, so downstream
 * components never see untyped provider payloads.</p>
 */
public final class SourceFields {

    private final Map<FieldKey, Object> values;
    private final Map<Provider, String> crossReferences;
    private final Boolean current;

    private SourceFields(Builder builder) {
        this.values = Collections.unmodifiableMap(new EnumMap<>(builder.values));
        this.crossReferences = Collections.unmodifiableMap(new EnumMap<>(builder.crossReferences));
        this.current = builder.current;
    }

    public Object get(FieldKey key) {
        return values.get(key);
    }

    public <T> Optional<T> get(FieldKey key, Class<T> type) {
        return Optional.ofNullable(values.get(key)).map(type::cast);
    }

    public boolean has(FieldKey key) {
        return values.containsKey(key);
    }

    /**
     * Populated fields in declaration order.
     */
    public Map<FieldKey, Object> asMap() {
        return values;
    }

    /**
     * Identifiers of other providers carried by this record, e.g. a roster record's
     * campaign-finance candidate id.
     */
    public Map<Provider, String> crossReferences() {
        return crossReferences;
    }

    /**
     * Whether the provider reports this official as currently serving; null when unknown.
     */
    public Boolean current() {
        return current;
    }

    public Optional<NameParts> name() {
        return get(FieldKey.NAME, NameParts.class);
    }

    public Optional<String> office() {
        return get(FieldKey.OFFICE, String.class);
    }

    public Optional<String> jurisdiction() {
        return get(FieldKey.JURISDICTION, String.class);
    }

    public Optional<String> district() {
        return get(FieldKey.DISTRICT, String.class);
    }

    public Optional<GovernmentLevel> level() {
        return get(FieldKey.LEVEL, GovernmentLevel.class);
    }

    public Optional<LocalDate> termStart() {
        return get(FieldKey.TERM_START, LocalDate.class);
    }

    public Optional<LocalDate> termEnd() {
        return get(FieldKey.TERM_END, LocalDate.class);
    }

    /**
     * The office slot this record claims, when office and jurisdiction are both present.
     */
    public Optional<OfficeSlot> officeSlot() {
        if (office().isEmpty() || jurisdiction().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new OfficeSlot(office().get(), jurisdiction().get(), district().orElse(null)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<FieldKey, Object> values = new EnumMap<>(FieldKey.class);
        private final Map<Provider, String> crossReferences = new EnumMap<>(Provider.class);
        private Boolean current;

        /**
         * Sets a field. Null and blank string values are ignored.
         */
        public Builder set(FieldKey key, Object value) {
            if (value == null || (value instanceof String s && s.isBlank())) {
                return this;
            }
            values.put(key, key.checkValue(value instanceof String s ? s.trim() : value));
            return this;
        }

        public Builder name(NameParts name) {
            return set(FieldKey.NAME, name);
        }

        public Builder name(String displayName) {
            return displayName == null || displayName.isBlank() ? this : name(NameParts.parse(displayName));
        }

        public Builder level(GovernmentLevel level) {
            return set(FieldKey.LEVEL, level);
        }

        public Builder office(String office) {
            return set(FieldKey.OFFICE, office);
        }

        public Builder jurisdiction(String jurisdiction) {
            return set(FieldKey.JURISDICTION, jurisdiction);
        }

        public Builder district(String district) {
            return set(FieldKey.DISTRICT, district);
        }

        public Builder party(String party) {
            return set(FieldKey.PARTY, party);
        }

        public Builder termStart(LocalDate termStart) {
            return set(FieldKey.TERM_START, termStart);
        }

        public Builder termEnd(LocalDate termEnd) {
            return set(FieldKey.TERM_END, termEnd);
        }

        public Builder email(String email) {
            return set(FieldKey.EMAIL, email);
        }

        public Builder phone(String phone) {
            return set(FieldKey.PHONE, phone);
        }

        public Builder website(String website) {
            return set(FieldKey.WEBSITE, website);
        }

        public Builder photoUrl(String photoUrl) {
            return set(FieldKey.PHOTO_URL, photoUrl);
        }

        public Builder finance(FinanceSummary finance) {
            return set(FieldKey.FINANCE, finance);
        }

        public Builder statusHint(StatusReason hint) {
            return set(FieldKey.STATUS_HINT, hint);
        }

        public Builder crossReference(Provider provider, String externalId) {
            if (externalId != null && !externalId.isBlank()) {
                crossReferences.put(provider, externalId.trim());
            }
            return this;
        }

        public Builder current(Boolean current) {
            this.current = current;
            return this;
        }

        public SourceFields build() {
            return new SourceFields(this);
        }
    }
}
