package com.healthrevo.decision.normalizer;

/**
 * Similarity metric used to compare a cleaned medication mention with vocabulary terms.
 * Implementations must be deterministic and return values in [0, 1], where 1 means identical.
 */
public interface StringSimilarity {

    double similarity(String a, String b);

    String name();
}
