package com.civics.ingest.similarity;

import com.civics.ingest.core.model.CanonicalRepresentative;
import com.civics.ingest.core.model.FieldKey;
import com.civics.ingest.core.model.SourceFields;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static com.civics.ingest.support.Fixtures.TERM_START;
import static com.civics.ingest.support.Fixtures.federalFields;
import static com.civics.ingest.support.Fixtures.representative;
import static org.junit.jupiter.api.Assertions.*;

class RepresentativeSimilarityScorerTest {

    private RepresentativeSimilarityScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new RepresentativeSimilarityScorer();
    }

    @Test
    @DisplayName("Should score an identical representative at 1.0")
    void testIdenticalScore() {
        SourceFields record = federalFields("Jane Doe", "CA", "12").build();
        CanonicalRepresentative candidate = representative("c-1", "Jane Doe", "CA", "12", null)
                .field(FieldKey.TERM_START, TERM_START)
                .build();

        SimilarityBreakdown breakdown = scorer.score(record, candidate);

        assertEquals(1.0, breakdown.name(), 0.0001);
        assertEquals(1.0, breakdown.office());
        assertEquals(1.0, breakdown.district());
        assertEquals(1.0, breakdown.termOverlap());
        assertEquals(1.0, breakdown.score(), 0.0001);
    }

    @Test
    @DisplayName("Should treat an unknown term as half overlap")
    void testUnknownTerm() {
        SourceFields record = federalFields("Jane Doe", "CA", "12").build();
        CanonicalRepresentative candidate = representative("c-1", "Jane Doe", "CA", "12", null).build();

        SimilarityBreakdown breakdown = scorer.score(record, candidate);

        assertEquals(0.5, breakdown.termOverlap());
        assertEquals(0.95, breakdown.score(), 0.0001);
    }

    @Test
    @DisplayName("Should match inverted names and zero-padded districts")
    void testNormalizedComparisons() {
        SourceFields record = federalFields("Doe, Jane", "CA", "05").build();
        CanonicalRepresentative candidate = representative("c-1", "Rep. Jane Doe", "CA", "5", null).build();

        SimilarityBreakdown breakdown = scorer.score(record, candidate);

        assertEquals(1.0, breakdown.name(), 0.0001);
        assertEquals(1.0, breakdown.district());
    }

    @Test
    @DisplayName("Should score a different seat low even with the same name")
    void testDifferentSeat() {
        SourceFields record = federalFields("Jane Doe", "CA", null).build();
        CanonicalRepresentative candidate = representative("c-1", "Jane Doe", "CA", "12", null).build();

        SimilarityBreakdown breakdown = scorer.score(record, candidate);

        assertEquals(0.0, breakdown.office());
        assertEquals(0.0, breakdown.district());
        assertTrue(breakdown.score() < 0.80, breakdown.toString());
    }

    @Test
    @DisplayName("Should return zero name similarity for a blank side")
    void testBlankName() {
        assertEquals(0.0, scorer.nameSimilarity("Jane Doe", " "));
        assertEquals(0.0, scorer.nameSimilarity(null, "Jane Doe"));
    }

    @Test
    @DisplayName("Should detect term overlap with open ends")
    void testTermOverlap() {
        LocalDate jan2019 = LocalDate.of(2019, 1, 3);
        LocalDate jan2021 = LocalDate.of(2021, 1, 3);

        assertEquals(1.0, RepresentativeSimilarityScorer.termOverlap(jan2019, null, jan2021, null));
        assertEquals(0.0, RepresentativeSimilarityScorer.termOverlap(jan2019, jan2021.minusDays(1), jan2021, null));
        assertEquals(0.5, RepresentativeSimilarityScorer.termOverlap(null, null, jan2021, null));
    }

    @Nested
    @DisplayName("Algorithms")
    class Algorithms {

        @Test
        @DisplayName("Should compute Jaro-Winkler with prefix boost")
        void testJaroWinkler() {
            JaroWinklerSimilarity jw = new JaroWinklerSimilarity();

            assertEquals(0.9611, jw.compute("martha", "marhta"), 0.001);
            assertEquals(1.0, jw.compute("doe", "doe"));
            assertEquals(0.0, jw.compute("abc", "xyz"));
            assertEquals(0.0, jw.compute("", "doe"));
            assertThrows(IllegalArgumentException.class, () -> new JaroWinklerSimilarity(0.3));
        }

        @Test
        @DisplayName("Should compute token Jaccard regardless of order")
        void testJaccard() {
            JaccardSimilarity jaccard = new JaccardSimilarity();

            assertEquals(1.0, jaccard.compute("john smith", "smith john"));
            assertEquals(2.0 / 3.0, jaccard.compute("john a smith", "john smith"), 0.0001);
            assertEquals(0.0, jaccard.compute(null, "john"));
        }

        @Test
        @DisplayName("Should require weights summing to one")
        void testWeights() {
            assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(0.5, 0.5, 0.5, 0.0));
            assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(-0.1, 0.5, 0.5, 0.1));
            assertDoesNotThrow(SimilarityWeights::defaultWeights);
        }
    }
}
