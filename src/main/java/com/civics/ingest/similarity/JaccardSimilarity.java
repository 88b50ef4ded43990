package com.civics.ingest.similarity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Token-set Jaccard similarity. Insensitive to word order, so "smith john" and
 * "john smith" score 1.0.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> a = tokens(s1);
        Set<String> b = tokens(s2);
        if (a.isEmpty() || b.isEmpty()) {
            return a.isEmpty() && b.isEmpty() && s1.equals(s2) ? 1.0 : 0.0;
        }
        long shared = a.stream().filter(b::contains).count();
        return (double) shared / (a.size() + b.size() - shared);
    }

    @Override
    public String getName() {
        return "jaccard";
    }

    private static Set<String> tokens(String s) {
        return Arrays.stream(s.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }
}
