package com.healthrevo.decision.prescription;

import com.healthrevo.decision.normalizer.NormalizationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based review of a normalized medication list: unmatched mentions, duplicate drugs and
 * configured single-dose limits.
 */
public class DosageReview {

    private static final Pattern MILLIGRAMS = Pattern.compile("(?i)(\\d+(?:\\.\\d+)?)\\s*(mg|g|gm|mcg|µg|ug)\\b");

    private final Map<String, DoseLimit> limitsByDrug = new LinkedHashMap<>();

    public DosageReview(List<DoseLimit> limits) {
        for (DoseLimit limit : limits) {
            limitsByDrug.put(limit.getDrugId(), limit);
        }
    }

    public List<PrescriptionFinding> review(List<NormalizationResult> results) {
        List<PrescriptionFinding> findings = new ArrayList<>();
        Map<String, Integer> occurrences = new LinkedHashMap<>();

        for (NormalizationResult result : results) {
            if (!result.isMatched()) {
                findings.add(unmatched(result));
                continue;
            }
            occurrences.merge(result.getDrugId(), 1, Integer::sum);

            DoseLimit limit = limitsByDrug.get(result.getDrugId());
            Double milligrams = milligrams(result);
            if (limit != null && milligrams != null && milligrams >= limit.getReviewAtMg()) {
                findings.add(PrescriptionFinding.builder()
                    .severity(FindingSeverity.MEDIUM)
                    .type(FindingType.DOSE)
                    .message(String.format(Locale.ROOT,
                        "High single dose of %s (%s mg). Review total daily dose.",
                        result.getDrugName(), formatMg(milligrams)))
                    .build());
            }
        }

        occurrences.forEach((drugId, count) -> {
            if (count > 1) {
                findings.add(PrescriptionFinding.builder()
                    .severity(FindingSeverity.LOW)
                    .type(FindingType.DUPLICATE)
                    .message(String.format(Locale.ROOT, "Duplicate medication entries detected for '%s' (%d entries).", drugId, count))
                    .build());
            }
        });
        return findings;
    }

    private static PrescriptionFinding unmatched(NormalizationResult result) {
        String raw = result.getMention().getRawName();
        String message = result.hasCandidate()
            ? String.format(Locale.ROOT, "Medication '%s' could not be matched with confidence (closest: %s, %.2f); review manually.",
                raw, result.getDrugName(), result.getConfidence())
            : String.format(Locale.ROOT, "Medication '%s' could not be matched to the vocabulary; review manually.", raw);
        return PrescriptionFinding.builder()
            .severity(FindingSeverity.LOW)
            .type(FindingType.UNMATCHED)
            .message(message)
            .build();
    }

    private static Double milligrams(NormalizationResult result) {
        String dose = result.getMention().getDose();
        Matcher matcher = MILLIGRAMS.matcher(dose == null || dose.isBlank() ? result.getMention().getRawName() : dose);
        if (!matcher.find()) {
            return null;
        }
        double amount = Double.parseDouble(matcher.group(1));
        switch (matcher.group(2).toLowerCase(Locale.ROOT)) {
            case "g":
            case "gm":
                return amount * 1000;
            case "mcg":
            case "µg":
            case "ug":
                return amount / 1000;
            default:
                return amount;
        }
    }

    private static String formatMg(double milligrams) {
        return milligrams == Math.rint(milligrams) ? String.valueOf((long) milligrams) : String.valueOf(milligrams);
    }
}
