package com.healthrevo.pipeline.controller;

import com.healthrevo.pipeline.dto.ErrorResponse;
import com.healthrevo.pipeline.dto.NormalizeRequest;
import com.healthrevo.pipeline.dto.VocabularyImportRequest;
import com.healthrevo.pipeline.dto.VocabularyImportResult;
import com.healthrevo.pipeline.service.VocabularyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/vocabulary")
@Tag(name = "Vocabulary", description = "Drug vocabulary and interaction dataset administration")
public class VocabularyController {

    private static final Logger logger = LoggerFactory.getLogger(VocabularyController.class);

    private final VocabularyService vocabularyService;

    public VocabularyController(VocabularyService vocabularyService) {
        this.vocabularyService = vocabularyService;
    }

    @PostMapping("/import")
    @Operation(summary = "Import vocabulary CSV",
               description = "REPLACE swaps in a snapshot built from the datasets alone; MERGE overlays them on the current one")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Import applied",
                    content = @Content(schema = @Schema(implementation = VocabularyImportResult.class))),
        @ApiResponse(responseCode = "400", description = "Unreadable CSV or unknown mode",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public Mono<ResponseEntity<Object>> importVocabulary(@RequestBody VocabularyImportRequest request) {
        logger.info("Received vocabulary import (mode={})", request.getMode());
        return vocabularyService.importCsv(request)
            .map(result -> ResponseEntity.<Object>ok(result))
            .onErrorResume(error -> ApiErrors.toResponse("import vocabulary", error));
    }

    @GetMapping("/drugs")
    @Operation(summary = "Get the current drug vocabulary")
    public Mono<ResponseEntity<Object>> getDrugs() {
        return Mono.fromCallable(vocabularyService::getDrugs)
            .map(drugs -> ResponseEntity.<Object>ok(drugs))
            .onErrorResume(error -> ApiErrors.toResponse("read vocabulary", error));
    }

    @PostMapping("/normalize")
    @Operation(summary = "Preview medication normalization",
               description = "Matches names against the current vocabulary without storing anything")
    public Mono<ResponseEntity<Object>> normalize(@RequestBody NormalizeRequest request) {
        return Mono.fromCallable(() -> vocabularyService.normalize(request.getNames()))
            .map(results -> ResponseEntity.<Object>ok(results))
            .onErrorResume(error -> ApiErrors.toResponse("normalize medications", error));
    }
}
