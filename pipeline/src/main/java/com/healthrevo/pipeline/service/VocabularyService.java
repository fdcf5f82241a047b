package com.healthrevo.pipeline.service;

import com.healthrevo.decision.model.CanonicalDrug;
import com.healthrevo.decision.model.MedicationMention;
import com.healthrevo.decision.normalizer.MedicationNormalizer;
import com.healthrevo.decision.normalizer.NormalizationResult;
import com.healthrevo.decision.vocabulary.ImportMode;
import com.healthrevo.decision.vocabulary.VocabularyCsvReader;
import com.healthrevo.decision.vocabulary.VocabularyImport;
import com.healthrevo.decision.vocabulary.VocabularySnapshot;
import com.healthrevo.decision.vocabulary.VocabularyStore;
import com.healthrevo.pipeline.dto.VocabularyImportRequest;
import com.healthrevo.pipeline.dto.VocabularyImportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Service
public class VocabularyService {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyService.class);

    private final VocabularyStore vocabularyStore;
    private final VocabularyCsvReader csvReader;
    private final MedicationNormalizer normalizer;

    public VocabularyService(VocabularyStore vocabularyStore, VocabularyCsvReader csvReader, MedicationNormalizer normalizer) {
        this.vocabularyStore = vocabularyStore;
        this.csvReader = csvReader;
        this.normalizer = normalizer;
    }

    public Mono<VocabularyImportResult> importCsv(VocabularyImportRequest request) {
        return Mono.fromCallable(() -> {
            ImportMode mode = parseMode(request.getMode());
            if (isBlank(request.getDrugsCsv()) && isBlank(request.getInteractionsCsv())) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "drugsCsv or interactionsCsv is required");
            }
            Reader drugs = isBlank(request.getDrugsCsv()) ? null : new StringReader(request.getDrugsCsv());
            Reader interactions = isBlank(request.getInteractionsCsv()) ? null : new StringReader(request.getInteractionsCsv());
            return importFrom(mode, drugs, interactions);
        }).onErrorMap(IOException.class,
            error -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unreadable vocabulary CSV: " + error.getMessage(), error));
    }

    /**
     * Reads both datasets and swaps the resulting snapshot in. Readers are not closed here.
     */
    public VocabularyImportResult importFrom(ImportMode mode, Reader drugsCsv, Reader interactionsCsv) throws IOException {
        VocabularyImport parsed = csvReader.read(drugsCsv, interactionsCsv);
        VocabularySnapshot snapshot = vocabularyStore.apply(mode, parsed.getDrugs(), parsed.getInteractions());
        logger.info("Imported {} drugs and {} interactions ({}), {} rows skipped",
            parsed.getDrugs().size(), parsed.getInteractions().size(), mode, parsed.getSkippedRows());
        return VocabularyImportResult.builder()
            .mode(mode.name())
            .importedDrugs(parsed.getDrugs().size())
            .importedInteractions(parsed.getInteractions().size())
            .skippedRows(parsed.getSkippedRows())
            .drugCount(snapshot.drugCount())
            .interactionCount(snapshot.interactionCount())
            .version(snapshot.getVersion())
            .build();
    }

    public List<CanonicalDrug> getDrugs() {
        return vocabularyStore.snapshot().drugs().stream()
            .sorted(Comparator.comparing(CanonicalDrug::getId))
            .toList();
    }

    public List<NormalizationResult> normalize(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "names is required");
        }
        List<MedicationMention> mentions = names.stream().map(MedicationMention::named).toList();
        return normalizer.normalizeAll(mentions, vocabularyStore.snapshot());
    }

    private static ImportMode parseMode(String mode) {
        if (isBlank(mode)) {
            return ImportMode.MERGE;
        }
        try {
            return ImportMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "mode must be REPLACE or MERGE");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
