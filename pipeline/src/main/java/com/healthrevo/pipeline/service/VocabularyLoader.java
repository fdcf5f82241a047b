package com.healthrevo.pipeline.service;

import com.healthrevo.decision.vocabulary.ImportMode;
import com.healthrevo.pipeline.config.CdsProperties;
import com.healthrevo.pipeline.dto.VocabularyImportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Loads the seed vocabulary when the service starts.
 */
@Component
public class VocabularyLoader implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyLoader.class);

    private final VocabularyService vocabularyService;
    private final ResourceLoader resourceLoader;
    private final CdsProperties properties;

    public VocabularyLoader(VocabularyService vocabularyService, ResourceLoader resourceLoader, CdsProperties properties) {
        this.vocabularyService = vocabularyService;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        CdsProperties.Vocabulary vocabulary = properties.getVocabulary();
        if (!vocabulary.isSeedOnStartup()) {
            logger.info("Vocabulary seeding disabled");
            return;
        }
        Resource drugs = resourceLoader.getResource(vocabulary.getDrugs());
        Resource interactions = resourceLoader.getResource(vocabulary.getInteractions());
        try (Reader drugsReader = new InputStreamReader(drugs.getInputStream(), StandardCharsets.UTF_8);
             Reader interactionsReader = new InputStreamReader(interactions.getInputStream(), StandardCharsets.UTF_8)) {
            VocabularyImportResult result = vocabularyService.importFrom(ImportMode.REPLACE, drugsReader, interactionsReader);
            logger.info("Seed vocabulary loaded from {}: {} drugs, {} interactions",
                drugs.getDescription(), result.getDrugCount(), result.getInteractionCount());
        }
    }
}
