package com.civics.ingest.similarity;

import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.NameParts;
import com.civics.ingest.core.model.SourceFields;
import com.civics.ingest.rules.NameNormalizationRules;
import com.civics.ingest.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * Scores how likely a source record describes an existing canonical representative.
 *
 * <p>score = w.name * max(jaroWinkler, jaccard) over normalized names
 * + w.office * officeMatch + w.district * districtMatch + w.termOverlap * termOverlap.
 * Office, district and term components are 0 or 1; an unknown term window counts as 0.5.</p>
 */
public class RepresentativeSimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(RepresentativeSimilarityScorer.class);

    private final NormalizationEngine normalizer;
    private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final JaccardSimilarity jaccard = new JaccardSimilarity();
    private final SimilarityWeights weights;

    public RepresentativeSimilarityScorer() {
        this(NameNormalizationRules.createDefaultEngine(), SimilarityWeights.defaultWeights());
    }

    public RepresentativeSimilarityScorer(NormalizationEngine normalizer, SimilarityWeights weights) {
        this.normalizer = normalizer;
        this.weights = weights;
    }

    public double nameSimilarity(String a, String b) {
        String n1 = normalizer.normalizeName(a);
        String n2 = normalizer.normalizeName(b);
        if (n1.isEmpty() || n2.isEmpty()) {
            return 0.0;
        }
        return Math.max(jaroWinkler.compute(n1, n2), jaccard.compute(n1, n2));
    }

    public SimilarityBreakdown score(SourceFields record, CanonicalRepresentative candidate) {
        double name = nameSimilarity(
                record.name().map(NameParts::display).orElse(null),
                candidate.getDisplayName());
        double office = record.office()
                .map(o -> normalizer.normalizeOffice(o).equals(normalizer.normalizeOffice(candidate.getOffice())))
                .orElse(false) ? 1.0 : 0.0;
        double district = Objects.equals(normalizeDistrict(record.district().orElse(null)),
                normalizeDistrict(candidate.getDistrict())) ? 1.0 : 0.0;
        double term = termOverlap(record.termStart().orElse(null), record.termEnd().orElse(null),
                candidate.getTermStart(), candidate.getTermEnd());

        double score = weights.name() * name
                + weights.office() * office
                + weights.district() * district
                + weights.termOverlap() * term;
        SimilarityBreakdown breakdown = new SimilarityBreakdown(name, office, district, term, score);
        log.debug("similarity.scored candidate={} {}", candidate.getCanonicalId(), breakdown);
        return breakdown;
    }

    static double termOverlap(LocalDate start1, LocalDate end1, LocalDate start2, LocalDate end2) {
        if (start1 == null || start2 == null) {
            return 0.5;
        }
        LocalDate e1 = end1 != null ? end1 : LocalDate.MAX;
        LocalDate e2 = end2 != null ? end2 : LocalDate.MAX;
        return !start1.isAfter(e2) && !start2.isAfter(e1) ? 1.0 : 0.0;
    }

    private static String normalizeDistrict(String district) {
        if (district == null || district.isBlank()) {
            return null;
        }
        return district.trim().toLowerCase(Locale.ROOT).replaceFirst("^0+(?=\\d)", "");
    }
}
