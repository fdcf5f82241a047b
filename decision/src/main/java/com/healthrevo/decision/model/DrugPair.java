package com.healthrevo.decision.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Unordered pair of canonical drug ids. {@code of("b", "a")} and {@code of("a", "b")} are equal.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DrugPair {
    String first;
    String second;

    public static DrugPair of(String a, String b) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) {
            throw new IllegalArgumentException("Drug ids are required");
        }
        if (a.equals(b)) {
            throw new IllegalArgumentException("A drug cannot interact with itself: " + a);
        }
        return a.compareTo(b) <= 0 ? new DrugPair(a, b) : new DrugPair(b, a);
    }

    public static DrugPair fromKey(String key) {
        int separator = key.indexOf('|');
        if (separator < 0) {
            throw new IllegalArgumentException("Invalid drug pair key: " + key);
        }
        return of(key.substring(0, separator), key.substring(separator + 1));
    }

    public String key() {
        return first + "|" + second;
    }

    public boolean contains(String drugId) {
        return first.equals(drugId) || second.equals(drugId);
    }
}
