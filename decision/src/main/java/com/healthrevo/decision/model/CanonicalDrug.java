package com.healthrevo.decision.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Locale;
import java.util.Set;

@Value
@Builder
public class CanonicalDrug {
    String id;
    String name;
    @Singular
    Set<String> aliases;
    @Singular
    Set<String> mechanismTags;

    /**
     * Stable identifier derived from a canonical name: lower case, runs of non-alphanumerics
     * collapsed to a single hyphen.
     */
    public static String idFor(String name) {
        String slug = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return slug.replaceAll("^-+|-+$", "");
    }
}
