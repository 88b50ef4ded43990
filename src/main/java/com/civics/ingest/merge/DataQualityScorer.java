package com.civics.ingest.merge;

import com.civics.ingest.core.model.FieldKey;
import com.civics.ingest.core.model.FieldProvenance;
import com.civics.ingest.core.model.GovernmentLevel;
import com.civics.ingest.core.model.Provider;
import com.civics.ingest.core.model.VerificationStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Derives the 0 to 100 data quality score from field provenance alone.
 *
 * <pre>
 * score = 100 * (0.5 * completeness + 0.3 * agreement + 0.2 * recency)
 * completeness = expected fields with provenance / expected fields for the level
 * agreement    = sum(agreeing) / sum(reporting) over all provenance entries
 * recency      = mean of 0.5^(lag / 365 days), lag measured from the freshest entry
 * </pre>
 *
 * The result is rounded to one decimal so that equal inputs always store equal scores.
 */
public class DataQualityScorer {

    public static final double VERIFIED_THRESHOLD = 70.0;
    private static final double HALF_LIFE_DAYS = 365.0;

    private static final Set<FieldKey> FEDERAL_EXPECTED = EnumSet.of(FieldKey.NAME, FieldKey.LEVEL,
            FieldKey.OFFICE, FieldKey.JURISDICTION, FieldKey.PARTY, FieldKey.TERM_START, FieldKey.WEBSITE,
            FieldKey.PHOTO_URL, FieldKey.PHONE);
    private static final Set<FieldKey> STATE_EXPECTED = EnumSet.of(FieldKey.NAME, FieldKey.LEVEL,
            FieldKey.OFFICE, FieldKey.JURISDICTION, FieldKey.DISTRICT, FieldKey.PARTY, FieldKey.EMAIL,
            FieldKey.PHONE, FieldKey.PHOTO_URL);
    private static final Set<FieldKey> LOCAL_EXPECTED = EnumSet.of(FieldKey.NAME, FieldKey.LEVEL,
            FieldKey.OFFICE, FieldKey.JURISDICTION, FieldKey.PHONE, FieldKey.WEBSITE, FieldKey.EMAIL);
    private static final Set<FieldKey> MINIMAL_EXPECTED = EnumSet.of(FieldKey.NAME, FieldKey.OFFICE,
            FieldKey.JURISDICTION);

    public double score(GovernmentLevel level, Map<FieldKey, FieldProvenance> provenance) {
        if (provenance.isEmpty()) {
            return 0.0;
        }
        Set<FieldKey> expected = expectedFields(level);
        long populated = expected.stream().filter(provenance::containsKey).count();
        double completeness = (double) populated / expected.size();

        Collection<FieldProvenance> entries = provenance.values();
        int reporting = entries.stream().mapToInt(FieldProvenance::reportingSources).sum();
        int agreeing = entries.stream().mapToInt(FieldProvenance::agreeingSources).sum();
        double agreement = (double) agreeing / reporting;

        Instant freshest = entries.stream().map(FieldProvenance::fetchedAt).max(Instant::compareTo).orElseThrow();
        double recency = entries.stream()
                .mapToDouble(p -> Math.pow(0.5, Duration.between(p.fetchedAt(), freshest).toMinutes()
                        / (HALF_LIFE_DAYS * 24 * 60)))
                .average()
                .orElse(0.0);

        double raw = 100.0 * (0.5 * completeness + 0.3 * agreement + 0.2 * recency);
        return Math.round(raw * 10.0) / 10.0;
    }

    /**
     * VERIFIED needs a score of at least {@value #VERIFIED_THRESHOLD} and a government roster
     * among the contributing providers.
     */
    public VerificationStatus verification(double score, Set<Provider> dataSources) {
        boolean governmentSourced = dataSources.stream().anyMatch(Provider::isGovernmentSource);
        return score >= VERIFIED_THRESHOLD && governmentSourced ? VerificationStatus.VERIFIED : VerificationStatus.PENDING;
    }

    static Set<FieldKey> expectedFields(GovernmentLevel level) {
        if (level == null) {
            return MINIMAL_EXPECTED;
        }
        return switch (level) {
            case FEDERAL -> FEDERAL_EXPECTED;
            case STATE -> STATE_EXPECTED;
            case LOCAL -> LOCAL_EXPECTED;
        };
    }
}
