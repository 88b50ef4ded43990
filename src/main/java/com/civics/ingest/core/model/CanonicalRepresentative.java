package com.civics.ingest.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The durable, deduplicated record of one officeholder-term.
 *
 * <p>Instances are immutable; every change goes through {@link #toBuilder()} and a store upsert.
 * Identity is the canonical id, which is generated once and never reused.</p>
 */
public final class CanonicalRepresentative {

    private final String canonicalId;
    private final Map<FieldKey, Object> fields;
    private final RepresentativeStatus status;
    private final StatusReason statusReason;
    private final Instant statusChangedAt;
    private final String replacedById;
    private final Map<Provider, String> crosswalk;
    private final Map<Provider, String> retiredCrosswalk;
    private final Map<FieldKey, FieldProvenance> fieldProvenance;
    private final double dataQualityScore;
    private final VerificationStatus verificationStatus;
    private final Instant createdAt;

    private CanonicalRepresentative(Builder builder) {
        this.canonicalId = builder.canonicalId != null ? builder.canonicalId : UUID.randomUUID().toString();
        this.fields = Collections.unmodifiableMap(new EnumMap<>(builder.fields));
        this.status = builder.status != null ? builder.status : RepresentativeStatus.ACTIVE;
        this.statusReason = builder.statusReason;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.statusChangedAt = builder.statusChangedAt != null ? builder.statusChangedAt : this.createdAt;
        this.replacedById = builder.replacedById;
        this.crosswalk = Collections.unmodifiableMap(new EnumMap<>(builder.crosswalk));
        this.retiredCrosswalk = Collections.unmodifiableMap(new EnumMap<>(builder.retiredCrosswalk));
        this.fieldProvenance = Collections.unmodifiableMap(new EnumMap<>(builder.fieldProvenance));
        this.dataQualityScore = builder.dataQualityScore;
        this.verificationStatus = builder.verificationStatus != null
                ? builder.verificationStatus : VerificationStatus.PENDING;

        if (replacedById != null && status != RepresentativeStatus.HISTORICAL) {
            throw new IllegalStateException("replacedById may only be set on historical entities: " + canonicalId);
        }
        if (canonicalId.equals(replacedById)) {
            throw new IllegalStateException("Entity cannot replace itself: " + canonicalId);
        }
    }

    public String getCanonicalId() {
        return canonicalId;
    }

    public Object getField(FieldKey key) {
        return fields.get(key);
    }

    public Map<FieldKey, Object> getFields() {
        return fields;
    }

    public NameParts getName() {
        return (NameParts) fields.get(FieldKey.NAME);
    }

    public String getDisplayName() {
        NameParts name = getName();
        return name != null ? name.display() : null;
    }

    public GovernmentLevel getLevel() {
        return (GovernmentLevel) fields.get(FieldKey.LEVEL);
    }

    public String getOffice() {
        return (String) fields.get(FieldKey.OFFICE);
    }

    public String getJurisdiction() {
        return (String) fields.get(FieldKey.JURISDICTION);
    }

    public String getDistrict() {
        return (String) fields.get(FieldKey.DISTRICT);
    }

    public String getParty() {
        return (String) fields.get(FieldKey.PARTY);
    }

    public LocalDate getTermStart() {
        return (LocalDate) fields.get(FieldKey.TERM_START);
    }

    public LocalDate getTermEnd() {
        return (LocalDate) fields.get(FieldKey.TERM_END);
    }

    public FinanceSummary getFinance() {
        return (FinanceSummary) fields.get(FieldKey.FINANCE);
    }

    public StatusReason getStatusHint() {
        return (StatusReason) fields.get(FieldKey.STATUS_HINT);
    }

    public ContactInfo getContact() {
        return new ContactInfo(
                (String) fields.get(FieldKey.EMAIL),
                (String) fields.get(FieldKey.PHONE),
                (String) fields.get(FieldKey.WEBSITE),
                (String) fields.get(FieldKey.PHOTO_URL),
                (String) fields.get(FieldKey.OFFICE_ADDRESS));
    }

    public SocialHandles getSocialHandles() {
        return new SocialHandles(
                (String) fields.get(FieldKey.TWITTER),
                (String) fields.get(FieldKey.FACEBOOK),
                (String) fields.get(FieldKey.YOUTUBE),
                (String) fields.get(FieldKey.INSTAGRAM));
    }

    public Optional<OfficeSlot> getOfficeSlot() {
        if (getOffice() == null || getJurisdiction() == null) {
            return Optional.empty();
        }
        return Optional.of(new OfficeSlot(getOffice(), getJurisdiction(), getDistrict()));
    }

    public RepresentativeStatus getStatus() {
        return status;
    }

    public StatusReason getStatusReason() {
        return statusReason;
    }

    public Instant getStatusChangedAt() {
        return statusChangedAt;
    }

    public String getReplacedById() {
        return replacedById;
    }

    public Map<Provider, String> getCrosswalk() {
        return crosswalk;
    }

    public Optional<String> getCrosswalkId(Provider provider) {
        return Optional.ofNullable(crosswalk.get(provider));
    }

    public boolean hasCrosswalk(Provider provider) {
        return crosswalk.containsKey(provider);
    }

    /**
     * Provider identifiers this entity held before a returning official's key moved to a
     * newer entity. Not indexed for lookups.
     */
    public Map<Provider, String> getRetiredCrosswalk() {
        return retiredCrosswalk;
    }

    public Map<FieldKey, FieldProvenance> getFieldProvenance() {
        return fieldProvenance;
    }

    public double getDataQualityScore() {
        return dataQualityScore;
    }

    public VerificationStatus getVerificationStatus() {
        return verificationStatus;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Providers that have contributed to this entity, in declaration order.
     */
    public Set<Provider> getDataSources() {
        return crosswalk.isEmpty() ? EnumSet.noneOf(Provider.class) : EnumSet.copyOf(crosswalk.keySet());
    }

    public boolean isActive() {
        return status == RepresentativeStatus.ACTIVE;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.canonicalId = canonicalId;
        b.fields.putAll(fields);
        b.status = status;
        b.statusReason = statusReason;
        b.statusChangedAt = statusChangedAt;
        b.replacedById = replacedById;
        b.crosswalk.putAll(crosswalk);
        b.retiredCrosswalk.putAll(retiredCrosswalk);
        b.fieldProvenance.putAll(fieldProvenance);
        b.dataQualityScore = dataQualityScore;
        b.verificationStatus = verificationStatus;
        b.createdAt = createdAt;
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalRepresentative that = (CanonicalRepresentative) o;
        return Objects.equals(canonicalId, that.canonicalId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(canonicalId);
    }

    /**
     * Value comparison over every persisted attribute, used to skip no-op writes.
     */
    public boolean sameContentAs(CanonicalRepresentative other) {
        return other != null
                && canonicalId.equals(other.canonicalId)
                && fields.equals(other.fields)
                && status == other.status
                && statusReason == other.statusReason
                && statusChangedAt.equals(other.statusChangedAt)
                && Objects.equals(replacedById, other.replacedById)
                && crosswalk.equals(other.crosswalk)
                && retiredCrosswalk.equals(other.retiredCrosswalk)
                && fieldProvenance.equals(other.fieldProvenance)
                && Double.compare(dataQualityScore, other.dataQualityScore) == 0
                && verificationStatus == other.verificationStatus
                && createdAt.equals(other.createdAt);
    }

    @Override
    public String toString() {
        return "CanonicalRepresentative{" +
                "id='" + canonicalId + '\'' +
                ", name='" + getDisplayName() + '\'' +
                ", slot=" + getOfficeSlot().map(OfficeSlot::toString).orElse("-") +
                ", status=" + status +
                ", crosswalk=" + crosswalk +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String canonicalId;
        private final Map<FieldKey, Object> fields = new EnumMap<>(FieldKey.class);
        private RepresentativeStatus status;
        private StatusReason statusReason;
        private Instant statusChangedAt;
        private String replacedById;
        private final Map<Provider, String> crosswalk = new EnumMap<>(Provider.class);
        private final Map<Provider, String> retiredCrosswalk = new EnumMap<>(Provider.class);
        private final Map<FieldKey, FieldProvenance> fieldProvenance = new EnumMap<>(FieldKey.class);
        private double dataQualityScore;
        private VerificationStatus verificationStatus;
        private Instant createdAt;

        public Builder canonicalId(String canonicalId) {
            this.canonicalId = canonicalId;
            return this;
        }

        /**
         * Sets or clears (when {@code value} is null) a displayed field.
         */
        public Builder field(FieldKey key, Object value) {
            if (value == null) {
                fields.remove(key);
            } else {
                fields.put(key, key.checkValue(value));
            }
            return this;
        }

        public Builder name(String displayName) {
            return field(FieldKey.NAME, NameParts.parse(displayName));
        }

        public Builder level(GovernmentLevel level) {
            return field(FieldKey.LEVEL, level);
        }

        public Builder office(String office) {
            return field(FieldKey.OFFICE, office);
        }

        public Builder jurisdiction(String jurisdiction) {
            return field(FieldKey.JURISDICTION, jurisdiction);
        }

        public Builder district(String district) {
            return field(FieldKey.DISTRICT, district);
        }

        public Builder party(String party) {
            return field(FieldKey.PARTY, party);
        }

        public Builder status(RepresentativeStatus status) {
            this.status = status;
            return this;
        }

        public Builder statusReason(StatusReason statusReason) {
            this.statusReason = statusReason;
            return this;
        }

        public Builder statusChangedAt(Instant statusChangedAt) {
            this.statusChangedAt = statusChangedAt;
            return this;
        }

        public Builder replacedById(String replacedById) {
            this.replacedById = replacedById;
            return this;
        }

        public Builder crosswalk(Provider provider, String externalId) {
            this.crosswalk.put(provider, externalId);
            return this;
        }

        public Builder removeCrosswalk(Provider provider) {
            this.crosswalk.remove(provider);
            return this;
        }

        public Builder retiredCrosswalk(Provider provider, String externalId) {
            this.retiredCrosswalk.put(provider, externalId);
            return this;
        }

        public Builder provenance(FieldKey key, FieldProvenance provenance) {
            if (provenance == null) {
                this.fieldProvenance.remove(key);
            } else {
                this.fieldProvenance.put(key, provenance);
            }
            return this;
        }

        public Builder dataQualityScore(double dataQualityScore) {
            this.dataQualityScore = dataQualityScore;
            return this;
        }

        public Builder verificationStatus(VerificationStatus verificationStatus) {
            this.verificationStatus = verificationStatus;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public CanonicalRepresentative build() {
            return new CanonicalRepresentative(this);
        }
    }
}
