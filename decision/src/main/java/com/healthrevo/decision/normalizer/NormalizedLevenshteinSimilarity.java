package com.healthrevo.decision.normalizer;

/**
 * {@code 1 - distance / max(len(a), len(b))}.
 */
public class NormalizedLevenshteinSimilarity implements StringSimilarity {

    public static final String NAME = "levenshtein";

    @Override
    public double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) EditDistance.levenshtein(a, b) / longest;
    }

    @Override
    public String name() {
        return NAME;
    }
}
