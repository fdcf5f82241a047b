package com.healthrevo.decision.vocabulary;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.healthrevo.decision.model.CanonicalDrug;
import com.healthrevo.decision.model.DrugPair;
import com.healthrevo.decision.model.InteractionRecord;
import com.healthrevo.decision.model.InteractionSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads vocabulary datasets in CSV form.
 *
 * <p>Drugs: {@code id,name,aliases,mechanisms} where {@code id} is optional and list columns are
 * separated by {@code ;}. Interactions: {@code drug_a,drug_b,severity,description,mechanism,management};
 * drug columns may hold ids or canonical names. Header names are case-insensitive, extra columns are
 * ignored and rows missing required values are skipped.
 */
public class VocabularyCsvReader {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyCsvReader.class);

    private final ObjectReader rowReader;

    public VocabularyCsvReader() {
        CsvMapper csvMapper = new CsvMapper();
        this.rowReader = csvMapper.readerForMapOf(String.class).with(CsvSchema.emptySchema().withHeader());
    }

    public VocabularyImport read(Reader drugsCsv, Reader interactionsCsv) throws IOException {
        int[] skipped = {0};
        List<CanonicalDrug> drugs = drugsCsv == null ? List.of() : readDrugs(drugsCsv, skipped);
        List<InteractionRecord> interactions = interactionsCsv == null ? List.of() : readInteractions(interactionsCsv, skipped);
        logger.info("Read {} drugs and {} interactions from CSV ({} rows skipped)",
            drugs.size(), interactions.size(), skipped[0]);
        return VocabularyImport.builder()
            .drugs(drugs)
            .interactions(interactions)
            .skippedRows(skipped[0])
            .build();
    }

    private List<CanonicalDrug> readDrugs(Reader csv, int[] skipped) throws IOException {
        List<CanonicalDrug> drugs = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = rowReader.readValues(csv)) {
            while (rows.hasNext()) {
                Map<String, String> row = lowerCaseKeys(rows.next());
                String name = value(row, "name");
                if (name == null) {
                    logger.warn("Skipping drug row without name: {}", row);
                    skipped[0]++;
                    continue;
                }
                String id = value(row, "id");
                drugs.add(CanonicalDrug.builder()
                    .id(id == null ? CanonicalDrug.idFor(name) : CanonicalDrug.idFor(id))
                    .name(name)
                    .aliases(splitList(value(row, "aliases")))
                    .mechanismTags(splitList(value(row, "mechanisms")))
                    .build());
            }
        }
        return drugs;
    }

    private List<InteractionRecord> readInteractions(Reader csv, int[] skipped) throws IOException {
        List<InteractionRecord> interactions = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = rowReader.readValues(csv)) {
            while (rows.hasNext()) {
                Map<String, String> row = lowerCaseKeys(rows.next());
                String drugA = firstValue(row, "drug_a", "a");
                String drugB = firstValue(row, "drug_b", "b");
                String description = firstValue(row, "description", "desc");
                if (drugA == null || drugB == null || description == null) {
                    logger.warn("Skipping interaction row missing drug_a, drug_b or description: {}", row);
                    skipped[0]++;
                    continue;
                }
                String idA = CanonicalDrug.idFor(drugA);
                String idB = CanonicalDrug.idFor(drugB);
                if (idA.isEmpty() || idB.isEmpty() || idA.equals(idB)) {
                    logger.warn("Skipping interaction row with invalid drug pair: {} / {}", drugA, drugB);
                    skipped[0]++;
                    continue;
                }
                interactions.add(InteractionRecord.builder()
                    .pair(DrugPair.of(idA, idB))
                    .severity(InteractionSeverity.fromLabel(value(row, "severity")))
                    .description(description)
                    .mechanism(value(row, "mechanism"))
                    .management(firstValue(row, "clinical_management", "management"))
                    .build());
            }
        }
        return interactions;
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> row) {
        Map<String, String> normalized = new HashMap<>();
        row.forEach((key, value) -> normalized.put(key.trim().toLowerCase(Locale.ROOT), value));
        return normalized;
    }

    private static String firstValue(Map<String, String> row, String... keys) {
        for (String key : keys) {
            String value = value(row, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String value(Map<String, String> row, String key) {
        String value = row.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static List<String> splitList(String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split("[;|]"))
            .map(String::trim)
            .filter(part -> !part.isEmpty())
            .toList();
    }
}
