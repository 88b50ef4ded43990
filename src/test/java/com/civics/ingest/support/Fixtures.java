package com.civics.ingest.support;

import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.FinanceSummary;
import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.SourceFields;
import com.civics.ingest.core.model.SourceRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Source records and representatives shared by the tests.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2025-01-10T12:00:00Z");
    public static final LocalDate TERM_START = LocalDate.of(2023, 1, 3);

    private Fixtures() {
    }

    /**
     * Fields of a currently serving member of Congress. A null district means a senator.
     */
    public static SourceFields.Builder federalFields(String name, String state, String district) {
        return SourceFields.builder()
                .name(name)
                .level(GovernmentLevel.FEDERAL)
                .office(district == null ? "U.S. Senator" : "U.S. Representative")
                .jurisdiction(state)
                .district(district)
                .party("Independent")
                .termStart(TERM_START)
                .current(true);
    }

    public static SourceRecord federalMember(String bioguideId, String name, String state, String district,
                                             Instant fetchedAt) {
        return record(Provider.FEDERAL_ROSTER, bioguideId, fetchedAt, federalFields(name, state, district));
    }

    public static SourceRecord stateLegislator(String personId, String name, String state, String office,
                                               String district, Instant fetchedAt) {
        return record(Provider.STATE_LEGISLATURE, personId, fetchedAt, SourceFields.builder()
                .name(name)
                .level(GovernmentLevel.STATE)
                .office(office)
                .jurisdiction(state)
                .district(district)
                .party("Democratic")
                .termStart(TERM_START)
                .current(true));
    }

    /**
     * A campaign-finance record for a House candidate, cross-referenced to a bioguide id when given.
     */
    public static SourceRecord financeCandidate(String candidateId, String name, String state, String district,
                                                String bioguideId, Instant fetchedAt) {
        return record(Provider.CAMPAIGN_FINANCE, candidateId, fetchedAt, SourceFields.builder()
                .name(name)
                .level(GovernmentLevel.FEDERAL)
                .office(district == null ? "U.S. Senator" : "U.S. Representative")
                .jurisdiction(state)
                .district(district)
                .party("Finance Party")
                .finance(financeSummary(candidateId))
                .crossReference(Provider.FEDERAL_ROSTER, bioguideId));
    }

    public static FinanceSummary financeSummary(String candidateId) {
        return new FinanceSummary(candidateId, 2024, new BigDecimal("1500000.00"), new BigDecimal("1200000.00"),
                new BigDecimal("300000.00"), LocalDate.of(2024, 12, 31));
    }

    public static SourceRecord record(Provider provider, String externalId, Instant fetchedAt,
                                      SourceFields.Builder fields) {
        return new SourceRecord(provider, externalId, fetchedAt, fields.build());
    }

    /**
     * An active federal representative holding {@code bioguideId} as its roster key.
     */
    public static CanonicalRepresentative.Builder representative(String canonicalId, String name, String state,
                                                                 String district, String bioguideId) {
        CanonicalRepresentative.Builder builder = CanonicalRepresentative.builder()
                .canonicalId(canonicalId)
                .name(name)
                .level(GovernmentLevel.FEDERAL)
                .office(district == null ? "U.S. Senator" : "U.S. Representative")
                .jurisdiction(state)
                .district(district)
                .createdAt(T0);
        if (bioguideId != null) {
            builder.crosswalk(Provider.FEDERAL_ROSTER, bioguideId);
        }
        return builder;
    }

    /**
     * Ids {@code prefix-1}, {@code prefix-2}, ... in call order.
     */
    public static Supplier<String> sequentialIds(String prefix) {
        AtomicInteger next = new AtomicInteger();
        return () -> prefix + "-" + next.incrementAndGet();
    }
}
