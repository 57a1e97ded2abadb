package com.dbtide.backend.controller;

import com.dbtide.backend.dto.DocumentStatus;
import com.dbtide.backend.dto.DocumentUpdateRequest;
import com.dbtide.backend.dto.ErrorResponse;
import com.dbtide.backend.service.DocumentService;
import com.dbtide.backend.service.DocumentSnapshot;
import com.dbtide.backend.service.TreeInspectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

@RestController
@RequestMapping("/api/documents")
@Validated
public class DocumentController {

    private static final Logger logger = LoggerFactory.getLogger(DocumentController.class);

    private final DocumentService documentService;
    private final TreeInspectionService treeInspectionService;

    public DocumentController(DocumentService documentService, TreeInspectionService treeInspectionService) {
        this.documentService = documentService;
        this.treeInspectionService = treeInspectionService;
    }

    @PutMapping
    public ResponseEntity<?> update(@Valid @RequestBody DocumentUpdateRequest request) {
        try {
            DocumentSnapshot snapshot = documentService
                .update(request.uri(), request.version(), request.text(), request.contentTypeOrDefault())
                .join();
            return ResponseEntity.ok(snapshot.status());

        } catch (CancellationException e) {
            return superseded(request, e);
        } catch (CompletionException e) {
            if (e.getCause() instanceof CancellationException cancelled) {
                return superseded(request, cancelled);
            }
            if (e.getCause() instanceof IllegalArgumentException invalid) {
                return ResponseEntity.badRequest()
                    .body(new ErrorResponse(invalid.getMessage(), HttpStatus.BAD_REQUEST.value()));
            }
            logger.error("Unexpected error while updating {}", request.uri(), e.getCause());
            return ResponseEntity.internalServerError()
                .body(new ErrorResponse("Internal server error: " + e.getCause().getMessage(),
                    HttpStatus.INTERNAL_SERVER_ERROR.value()));
        }
    }

    @GetMapping("/diagnostics")
    public ResponseEntity<DocumentStatus> diagnostics(@RequestParam String uri) {
        return ResponseEntity.ok(documentService.get(uri).status());
    }

    @GetMapping(value = "/tree", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> tree(@RequestParam String uri) {
        DocumentSnapshot snapshot = documentService.get(uri);
        return SyntaxAnalysisController.TreeResponses.toResponse(treeInspectionService.dump(snapshot.text(), uri));
    }

    @DeleteMapping
    public ResponseEntity<Void> close(@RequestParam String uri) {
        treeInspectionService.forget(uri);
        return documentService.close(uri) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    private ResponseEntity<ErrorResponse> superseded(DocumentUpdateRequest request, CancellationException e) {
        logger.debug("Update of {} to version {} was superseded", request.uri(), request.version());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse(e.getMessage() != null ? e.getMessage() : "Update was superseded",
                HttpStatus.CONFLICT.value()));
    }
}
