package com.healthrevo.decision.normalizer;

import java.util.Locale;

public final class SimilarityMetrics {

    private SimilarityMetrics() {
    }

    public static StringSimilarity byName(String name) {
        if (name == null || name.isBlank()) {
            return new NormalizedLevenshteinSimilarity();
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case NormalizedLevenshteinSimilarity.NAME:
                return new NormalizedLevenshteinSimilarity();
            case TrigramSimilarity.NAME:
                return new TrigramSimilarity();
            default:
                throw new IllegalArgumentException("Unknown similarity metric: " + name);
        }
    }
}
