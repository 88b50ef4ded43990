package com.civics.ingest.resolve;

/**
 * Thresholds of the fuzzy fallback.
 *
 * @param fuzzyEnabled      whether unmatched records are compared against existing entities at all
 * @param acceptThreshold   score at or above which a single candidate is matched automatically
 * @param reviewThreshold   score at or above which a new entity is flagged as a possible duplicate
 */
public record ResolverOptions(boolean fuzzyEnabled, double acceptThreshold, double reviewThreshold) {

    public static final double DEFAULT_ACCEPT_THRESHOLD = 0.92;
    public static final double DEFAULT_REVIEW_THRESHOLD = 0.80;

    public ResolverOptions {
        if (acceptThreshold <= 0.0 || acceptThreshold > 1.0) {
            throw new IllegalArgumentException("acceptThreshold must be in (0, 1]");
        }
        if (reviewThreshold < 0.0 || reviewThreshold > acceptThreshold) {
            throw new IllegalArgumentException("reviewThreshold must be in [0, acceptThreshold]");
        }
    }

    public static ResolverOptions defaults() {
        return new ResolverOptions(true, DEFAULT_ACCEPT_THRESHOLD, DEFAULT_REVIEW_THRESHOLD);
    }
}
