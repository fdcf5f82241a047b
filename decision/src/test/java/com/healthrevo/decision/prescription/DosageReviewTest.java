package com.healthrevo.decision.prescription;

import com.healthrevo.decision.model.MedicationMention;
import com.healthrevo.decision.normalizer.MatchStatus;
import com.healthrevo.decision.normalizer.NormalizationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DosageReviewTest {

    private final DosageReview review = new DosageReview(List.of(
        DoseLimit.builder().drugId("acetaminophen").reviewAtMg(1000).build()));

    @ParameterizedTest
    @CsvSource({
        "1000 mg, true",
        "1 g, true",
        "1500mg, true",
        "650 mg, false",
        "'', false"
    })
    @DisplayName("Should flag acetaminophen doses at or above the configured limit")
    void testDoseLimit(String dose, boolean flagged) {
        List<PrescriptionFinding> findings = review.review(List.of(matched("Paracetamol", dose, "acetaminophen")));

        assertThat(findings.stream().anyMatch(finding -> finding.getType() == FindingType.DOSE)).isEqualTo(flagged);
        findings.stream()
            .filter(finding -> finding.getType() == FindingType.DOSE)
            .forEach(finding -> assertThat(finding.getSeverity()).isEqualTo(FindingSeverity.MEDIUM));
    }

    @Test
    @DisplayName("Should flag duplicate canonical drugs once")
    void testDuplicates() {
        List<PrescriptionFinding> findings = review.review(List.of(
            matched("Advil", "200mg", "ibuprofen"),
            matched("Ibuprofen", "400mg", "ibuprofen"),
            matched("Aspirin", "75mg", "aspirin")));

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.getType()).isEqualTo(FindingType.DUPLICATE);
            assertThat(finding.getSeverity()).isEqualTo(FindingSeverity.LOW);
            assertThat(finding.getMessage()).contains("ibuprofen").contains("2 entries");
        });
    }

    @Test
    @DisplayName("Should report unmatched mentions for manual review")
    void testUnmatched() {
        NormalizationResult unmatched = NormalizationResult.builder()
            .mention(MedicationMention.named("Zebrafloxin"))
            .cleanedName("zebrafloxin")
            .status(MatchStatus.UNMATCHED)
            .drugId("ciprofloxacin")
            .drugName("Ciprofloxacin")
            .confidence(0.45)
            .build();

        List<PrescriptionFinding> findings = review.review(List.of(unmatched));

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.getType()).isEqualTo(FindingType.UNMATCHED);
            assertThat(finding.getSeverity()).isEqualTo(FindingSeverity.LOW);
            assertThat(finding.getMessage()).contains("Zebrafloxin").contains("Ciprofloxacin").contains("review manually");
        });
    }

    private static NormalizationResult matched(String rawName, String dose, String drugId) {
        return NormalizationResult.builder()
            .mention(MedicationMention.builder().rawName(rawName).dose(dose).frequency("").build())
            .cleanedName(rawName.toLowerCase())
            .status(MatchStatus.MATCHED)
            .drugId(drugId)
            .drugName(drugId)
            .matchedTerm(rawName.toLowerCase())
            .confidence(1.0)
            .build();
    }
}
