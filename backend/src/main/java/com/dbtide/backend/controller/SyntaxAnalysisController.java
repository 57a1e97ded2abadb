package com.dbtide.backend.controller;

import com.dbtide.backend.dto.PositionRequest;
import com.dbtide.backend.dto.PositionResponse;
import com.dbtide.backend.dto.SyntaxAnalysisRequest;
import com.dbtide.backend.dto.SyntaxAnalysisResponse;
import com.dbtide.backend.dto.TreeRequest;
import com.dbtide.backend.service.SyntaxAnalysisService;
import com.dbtide.backend.service.TreeInspectionService;
import com.dbtide.backend.service.TreeInspectionService.TreeDump;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/syntax")
@Validated
public class SyntaxAnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxAnalysisController.class);

    private final SyntaxAnalysisService syntaxAnalysisService;
    private final TreeInspectionService treeInspectionService;

    public SyntaxAnalysisController(SyntaxAnalysisService syntaxAnalysisService,
            TreeInspectionService treeInspectionService) {
        this.syntaxAnalysisService = syntaxAnalysisService;
        this.treeInspectionService = treeInspectionService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<SyntaxAnalysisResponse> analyzeSyntax(@Valid @RequestBody SyntaxAnalysisRequest request) {
        try {
            logger.debug("Received syntax analysis request for {} characters",
                request.sourceCode().length());

            SyntaxAnalysisResponse response = syntaxAnalysisService.analyzeSyntax(request);

            logger.debug("Syntax analysis completed: success={}, tokens={}",
                response.success(), response.tokens().size());

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during syntax analysis", e);
            return ResponseEntity.internalServerError()
                .body(SyntaxAnalysisResponse.error("Internal server error: " + e.getMessage(), 0));
        }
    }

    @PostMapping(value = "/tree", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> tree(@Valid @RequestBody TreeRequest request) {
        return TreeResponses.toResponse(treeInspectionService.dump(request.sourceCode(), request.documentKey()));
    }

    @PostMapping("/position")
    public ResponseEntity<PositionResponse> position(@Valid @RequestBody PositionRequest request) {
        try {
            return ResponseEntity.ok(syntaxAnalysisService.locate(request));
        } catch (Exception e) {
            logger.error("Unexpected error while locating {}:{}", request.line(), request.character(), e);
            return ResponseEntity.internalServerError().body(PositionResponse.notFound());
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Syntax analysis service is running");
    }

    /** Maps a {@link TreeDump} to a plain-text response; shared with the document endpoints. */
    static final class TreeResponses {

        private TreeResponses() {
        }

        static ResponseEntity<String> toResponse(TreeDump dump) {
            if (dump.success()) {
                return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(dump.dump());
            }
            StringBuilder body = new StringBuilder(dump.error()).append('\n');
            if (dump.previous() != null) {
                body.append("\nlast successful dump:\n").append(dump.previous());
            }
            HttpStatus status = dump.timedOut() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.INTERNAL_SERVER_ERROR;
            return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(body.toString());
        }
    }
}
