package com.dbtide.backend.service;

import com.dbtide.backend.config.DbtIdeProperties;
import com.dbtide.backend.dto.Diagnostic;
import com.dbtide.backend.dto.PositionRequest;
import com.dbtide.backend.dto.PositionResponse;
import com.dbtide.backend.dto.SyntaxAnalysisRequest;
import com.dbtide.backend.dto.SyntaxAnalysisResponse;
import com.dbtide.backend.dto.SyntaxToken;
import com.dbtide.backend.syntax.Lexer;
import com.dbtide.backend.syntax.ParseResult;
import com.dbtide.backend.syntax.Parser;
import com.dbtide.backend.syntax.SyntaxElement;
import com.dbtide.backend.syntax.SyntaxKind;
import com.dbtide.backend.syntax.Token;
import com.dbtide.backend.syntax.TokenKind;
import com.dbtide.backend.text.PositionFinder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class SyntaxAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxAnalysisService.class);

    private final DbtIdeProperties properties;

    public SyntaxAnalysisService(DbtIdeProperties properties) {
        this.properties = properties;
    }

    public SyntaxAnalysisResponse analyzeSyntax(SyntaxAnalysisRequest request) {
        long startTime = System.currentTimeMillis();
        String source = request.sourceCode();

        if (source.length() > properties.maxSourceCodeLength()) {
            return SyntaxAnalysisResponse.error(
                    "Source code exceeds maximum length of " + properties.maxSourceCodeLength() + " characters",
                    0);
        }

        try {
            List<Token> tokens = Lexer.tokenize(source);
            ParseResult result = Parser.parse(source, tokens);
            PositionFinder positions = new PositionFinder(source);

            List<SyntaxToken> syntaxTokens = tokens.stream()
                    .map(token -> SyntaxMapping.token(token, source, positions))
                    .toList();
            List<Diagnostic> diagnostics = SyntaxMapping.diagnostics(result.errors(), positions);

            long analysisTime = System.currentTimeMillis() - startTime;
            trace(syntaxTokens, diagnostics, analysisTime);

            return SyntaxAnalysisResponse.success(request.contentTypeOrDefault(), syntaxTokens, diagnostics,
                    analysisTime);

        } catch (Exception e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.error("Syntax analysis failed", e);
            return SyntaxAnalysisResponse.error("Syntax analysis failed: " + e.getMessage(), analysisTime);
        }
    }

    /** The token under a line/character position together with the blocks around it. */
    public PositionResponse locate(PositionRequest request) {
        String source = request.sourceCode();
        PositionFinder positions = new PositionFinder(source);
        int offset = positions.offset(request.line(), request.character());
        ParseResult result = Parser.parse(source);

        Optional<SyntaxElement> found = result.tree().tokenAt(offset);
        if (found.isEmpty()) {
            logger.debug("No token at {}:{} (offset {})", request.line(), request.character(), offset);
            return PositionResponse.notFound();
        }

        SyntaxElement element = found.get();
        Token token = new Token(element.tokenKind().orElse(TokenKind.ERROR), element.range());
        String enclosingBlock = element.enclosingBlock()
                .map(SyntaxElement::kind)
                .map(SyntaxKind::name)
                .orElse(null);
        List<String> ancestors = element.ancestors().stream()
                .map(ancestor -> ancestor.kind().name())
                .toList();

        return PositionResponse.of(SyntaxMapping.token(token, source, positions), enclosingBlock, ancestors);
    }

    private void trace(List<SyntaxToken> tokens, List<Diagnostic> diagnostics, long analysisTime) {
        switch (properties.traceLevel()) {
            case FULL -> {
                for (int i = 0; i < tokens.size(); i++) {
                    SyntaxToken token = tokens.get(i);
                    logger.debug("Token {}: '{}' -> {} at [{}:{}-{}:{}]",
                            i,
                            token.value(),
                            token.tokenType(),
                            token.startLine(),
                            token.startColumn(),
                            token.endLine(),
                            token.endColumn());
                }
                diagnostics.forEach(diagnostic -> logger.debug("Diagnostic {} at [{}:{}]: {}",
                        diagnostic.category(), diagnostic.startLine(), diagnostic.startColumn(),
                        diagnostic.message()));
                logSummary(tokens, diagnostics, analysisTime);
            }
            case SUMMARY -> logSummary(tokens, diagnostics, analysisTime);
            case OFF -> {
            }
        }
    }

    private void logSummary(List<SyntaxToken> tokens, List<Diagnostic> diagnostics, long analysisTime) {
        logger.info("Syntax analysis completed in {}ms with {} tokens and {} diagnostics",
                analysisTime, tokens.size(), diagnostics.size());
    }
}
