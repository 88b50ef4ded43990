package com.civics.ingest.similarity;

/**
 * Component scores behind one fuzzy comparison, kept for the audit trail.
 */
public record SimilarityBreakdown(double name, double office, double district, double termOverlap, double score) {

    @Override
    public String toString() {
        return String.format("score=%.3f name=%.3f office=%.1f district=%.1f term=%.1f",
                score, name, office, district, termOverlap);
    }
}
