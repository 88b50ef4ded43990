package com.civics.ingest.similarity;

/**
 * Weights of the fuzzy match components. Must sum to 1.0.
 */
public record SimilarityWeights(double name, double office, double district, double termOverlap) {

    public SimilarityWeights {
        if (name < 0 || office < 0 || district < 0 || termOverlap < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = name + office + district + termOverlap;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.60, 0.15, 0.15, 0.10);
    }
}
