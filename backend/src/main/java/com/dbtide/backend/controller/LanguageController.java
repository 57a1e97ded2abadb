package com.dbtide.backend.controller;

import com.dbtide.backend.dto.CompletionResponse;
import com.dbtide.backend.dto.DefinitionResponse;
import com.dbtide.backend.dto.HoverResponse;
import com.dbtide.backend.dto.TextDocumentPositionRequest;
import com.dbtide.backend.service.LanguageFeatureService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/language")
@Validated
public class LanguageController {

    private static final Logger logger = LoggerFactory.getLogger(LanguageController.class);

    private final LanguageFeatureService languageFeatureService;

    public LanguageController(LanguageFeatureService languageFeatureService) {
        this.languageFeatureService = languageFeatureService;
    }

    @PostMapping("/completion")
    public ResponseEntity<CompletionResponse> completion(@Valid @RequestBody TextDocumentPositionRequest request) {
        CompletionResponse response = languageFeatureService.completion(request);
        logger.debug("Completion at {}:{}:{} returned {} items",
            request.uri(), request.line(), request.character(), response.items().size());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/hover")
    public ResponseEntity<HoverResponse> hover(@Valid @RequestBody TextDocumentPositionRequest request) {
        return ResponseEntity.ok(languageFeatureService.hover(request));
    }

    @PostMapping("/definition")
    public ResponseEntity<DefinitionResponse> definition(@Valid @RequestBody TextDocumentPositionRequest request) {
        return ResponseEntity.ok(languageFeatureService.definition(request));
    }
}
