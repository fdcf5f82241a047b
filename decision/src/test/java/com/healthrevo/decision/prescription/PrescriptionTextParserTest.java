package com.healthrevo.decision.prescription;

import com.healthrevo.decision.model.MedicationMention;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PrescriptionTextParserTest {

    private final PrescriptionTextParser parser = new PrescriptionTextParser();

    @Test
    @DisplayName("Should split a multi-line prescription into mentions with dose, frequency and instructions")
    void testMultiLinePrescription() {
        String text = """
            Dr. A. Smith
            Patient: John Doe
            Rx
            1. Tab. Lisinopril 10mg once daily
            2. Ibuprofen 200mg
               Twice daily
               After meals
            3. Paracetamol
               500 mg
               1-0-1
            """;

        List<MedicationMention> mentions = parser.parse(text);

        assertThat(mentions).hasSize(3);
        assertThat(mentions.get(0).getRawName()).isEqualTo("Lisinopril");
        assertThat(mentions.get(0).getDose()).isEqualTo("10mg");
        assertThat(mentions.get(0).getFrequency()).isEqualTo("once daily");

        assertThat(mentions.get(1).getRawName()).isEqualTo("Ibuprofen");
        assertThat(mentions.get(1).getDose()).isEqualTo("200mg");
        assertThat(mentions.get(1).getFrequency()).isEqualTo("Twice daily");
        assertThat(mentions.get(1).getInstructions()).isEqualTo("After meals");

        assertThat(mentions.get(2).getRawName()).isEqualTo("Paracetamol");
        assertThat(mentions.get(2).getDose()).isEqualTo("500 mg");
        assertThat(mentions.get(2).getFrequency()).isEqualTo("1-0-1");
    }

    @Test
    @DisplayName("Should keep OCR typos in the raw name for the normalizer")
    void testOcrLines() {
        List<MedicationMention> mentions = parser.parse("Lisinopri1 10mg\nIbuprofen 200mg");

        assertThat(mentions).extracting(MedicationMention::getRawName).containsExactly("Lisinopri1", "Ibuprofen");
        assertThat(mentions).extracting(MedicationMention::getDose).containsExactly("10mg", "200mg");
    }

    @Test
    @DisplayName("Should return no mentions for blank text")
    void testBlankText() {
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("Rx\nDate: 2024-01-02\n")).isEmpty();
    }
}
