package com.healthrevo.decision.vocabulary;

import com.healthrevo.decision.model.DrugPair;
import com.healthrevo.decision.model.InteractionRecord;
import com.healthrevo.decision.model.InteractionSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;

class VocabularyCsvReaderTest {

    private final VocabularyCsvReader reader = new VocabularyCsvReader();

    @Test
    @DisplayName("Should read drugs with aliases and mechanism tags and skip rows without a name")
    void testReadDrugs() throws Exception {
        String drugs = """
            id,name,aliases,mechanisms
            ,Lisinopril,Zestril;Prinivil,
            ondansetron,Ondansetron,Zofran,qt_prolongation|serotonergic
            bad-row,,,
            """;

        VocabularyImport result = reader.read(new StringReader(drugs), null);

        assertThat(result.getDrugs()).hasSize(2);
        assertThat(result.getSkippedRows()).isEqualTo(1);
        assertThat(result.getDrugs().get(0).getId()).isEqualTo("lisinopril");
        assertThat(result.getDrugs().get(0).getAliases()).containsExactlyInAnyOrder("Zestril", "Prinivil");
        assertThat(result.getDrugs().get(1).getMechanismTags()).containsExactlyInAnyOrder("qt_prolongation", "serotonergic");
    }

    @Test
    @DisplayName("Should read interactions as unordered pairs and skip invalid rows")
    void testReadInteractions() throws Exception {
        String interactions = """
            drug_a,drug_b,severity,description,mechanism,clinical_management
            Warfarin,Aspirin,high,Increased bleeding risk,Additive anticoagulation,Monitor INR
            Aspirin,Aspirin,major,Self pair,,
            Lisinopril,,moderate,Missing partner,,
            """;

        VocabularyImport result = reader.read(null, new StringReader(interactions));

        assertThat(result.getInteractions()).singleElement().satisfies(record -> {
            assertThat(record.getPair()).isEqualTo(DrugPair.of("aspirin", "warfarin"));
            assertThat(record.getSeverity()).isEqualTo(InteractionSeverity.MAJOR);
            assertThat(record.getManagement()).isEqualTo("Monitor INR");
        });
        assertThat(result.getSkippedRows()).isEqualTo(2);
    }

    @ParameterizedTest
    @CsvSource({
        "low, MINOR",
        "Medium, MODERATE",
        "HIGH, MAJOR",
        "contra, CONTRAINDICATED",
        "contraindicated, CONTRAINDICATED",
        "severe-ish, MODERATE"
    })
    @DisplayName("Should normalize severity labels leniently")
    void testSeverityLabels(String label, InteractionSeverity expected) throws Exception {
        String interactions = "a,b,severity,desc\nx,y," + label + ",something\n";

        VocabularyImport result = reader.read(null, new StringReader(interactions));

        InteractionRecord record = result.getInteractions().get(0);
        assertThat(record.getSeverity()).isEqualTo(expected);
    }
}
