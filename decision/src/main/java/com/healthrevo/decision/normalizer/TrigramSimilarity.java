package com.healthrevo.decision.normalizer;

import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard similarity over padded character trigrams.
 */
public class TrigramSimilarity implements StringSimilarity {

    public static final String NAME = "trigram";

    @Override
    public double similarity(String a, String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        Set<String> left = trigrams(a);
        Set<String> right = trigrams(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    @Override
    public String name() {
        return NAME;
    }

    private static Set<String> trigrams(String value) {
        Set<String> grams = new HashSet<>();
        if (value.isEmpty()) {
            return grams;
        }
        String padded = "  " + value + " ";
        for (int i = 0; i + 3 <= padded.length(); i++) {
            grams.add(padded.substring(i, i + 3));
        }
        return grams;
    }
}
