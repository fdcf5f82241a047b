package com.healthrevo.decision.normalizer;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NormalizerSettings {
    /** Minimum similarity for a candidate to count as a match. */
    @Builder.Default
    double acceptanceThreshold = 0.8;
    /** Also compare the mention after folding OCR digit confusions (0/o, 1/l, 5/s, 8/b). */
    @Builder.Default
    boolean ocrFolding = true;
    /** Shortest single token of a multi-word mention that is compared on its own. */
    @Builder.Default
    int minTokenLength = 4;

    public static NormalizerSettings defaults() {
        return NormalizerSettings.builder().build();
    }
}
