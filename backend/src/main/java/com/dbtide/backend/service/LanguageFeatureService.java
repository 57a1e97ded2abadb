package com.dbtide.backend.service;

import com.dbtide.backend.dto.CompletionItem;
import com.dbtide.backend.dto.CompletionItem.CompletionKind;
import com.dbtide.backend.dto.CompletionResponse;
import com.dbtide.backend.dto.DefinitionResponse;
import com.dbtide.backend.dto.HoverResponse;
import com.dbtide.backend.dto.TextDocumentPositionRequest;
import com.dbtide.backend.outline.MacroDefinition;
import com.dbtide.backend.syntax.SyntaxElement;
import com.dbtide.backend.syntax.SyntaxKind;
import com.dbtide.backend.syntax.SyntaxTree;
import com.dbtide.backend.syntax.TextRange;
import com.dbtide.backend.syntax.TokenKind;
import com.dbtide.backend.text.Position;
import com.dbtide.backend.text.PositionFinder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Completion, hover and go-to-definition for open documents.
 *
 * <p>All three work from the document's latest published snapshot and the project index; none of them
 * reparses anything.
 */
@Service
public class LanguageFeatureService {

    private static final Logger logger = LoggerFactory.getLogger(LanguageFeatureService.class);

    private record Builtin(String name, List<String> arguments, String documentation) {

        String signature() {
            return name + "(" + String.join(", ", arguments) + ")";
        }

        String snippet() {
            StringBuilder snippet = new StringBuilder(name).append('(');
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) {
                    snippet.append(", ");
                }
                snippet.append("${").append(i + 1).append(':').append(arguments.get(i)).append('}');
            }
            return snippet.append(')').toString();
        }
    }

    private static final List<Builtin> BUILTINS = List.of(
            new Builtin("ref", List.of(), "https://docs.getdbt.com/reference/dbt-jinja-functions/ref"),
            new Builtin("source", List.of("source_name", "table_name"),
                    "https://docs.getdbt.com/reference/dbt-jinja-functions/source"),
            new Builtin("config", List.of(), "https://docs.getdbt.com/reference/dbt-jinja-functions/config"),
            new Builtin("env_var", List.of("ENV_VAR"), "https://docs.getdbt.com/reference/dbt-jinja-functions/env_var"),
            new Builtin("var", List.of("variable"), "https://docs.getdbt.com/reference/dbt-jinja-functions/var"),
            new Builtin("fromjson", List.of("json_str"),
                    "https://docs.getdbt.com/reference/dbt-jinja-functions/fromjson"),
            new Builtin("fromyaml", List.of("yaml_str"),
                    "https://docs.getdbt.com/reference/dbt-jinja-functions/fromyaml"),
            new Builtin("tojson", List.of("object"), "https://docs.getdbt.com/reference/dbt-jinja-functions/tojson"),
            new Builtin("toyaml", List.of("object"), "https://docs.getdbt.com/reference/dbt-jinja-functions/toyaml"));

    static final List<String> BLOCK_KEYWORDS = List.of(
            "if", "elif", "else", "endif",
            "for", "endfor",
            "set", "endset",
            "macro", "endmacro",
            "call", "endcall",
            "filter", "endfilter",
            "with", "endwith",
            "block", "endblock",
            "raw", "endraw",
            "do", "include", "import", "from", "extends",
            "materialization", "endmaterialization",
            "test", "endtest",
            "docs", "enddocs",
            "snapshot", "endsnapshot");

    /** Token kinds after which the cursor is outside any expression. */
    private static final Set<TokenKind> OUTSIDE_EXPRESSIONS = Set.of(
            TokenKind.DATA,
            TokenKind.COMMENT_BEGIN,
            TokenKind.COMMENT_DATA,
            TokenKind.COMMENT_END,
            TokenKind.RAW_BEGIN,
            TokenKind.RAW_END,
            TokenKind.VARIABLE_END,
            TokenKind.BLOCK_END,
            TokenKind.STRING_LITERAL);

    private final DocumentService documentService;
    private final ProjectService projectService;

    public LanguageFeatureService(DocumentService documentService, ProjectService projectService) {
        this.documentService = documentService;
        this.projectService = projectService;
    }

    public CompletionResponse completion(TextDocumentPositionRequest request) {
        DocumentSnapshot snapshot = documentService.get(request.uri());
        int offset = snapshot.positions().offset(request.line(), request.character());
        SyntaxTree tree = snapshot.result().tree();

        Optional<SyntaxElement> before = tokenBefore(tree, offset);
        if (before.isEmpty()) {
            return CompletionResponse.empty();
        }
        SyntaxElement token = before.get();

        Optional<String> modelPrefix = openStringPrefix(token, offset);
        if (modelPrefix.isPresent()) {
            return isRefArgument(token)
                    ? modelCompletions(modelPrefix.get(), false)
                    : CompletionResponse.empty();
        }

        SyntaxElement significant = skipWhitespaceBackwards(tree, token);
        TokenKind kind = significant.tokenKind().orElse(TokenKind.ERROR);
        String prefix = namePrefix(significant, offset);

        if (kind == TokenKind.BLOCK_BEGIN || (kind == TokenKind.NAME && !prefix.isEmpty()
                && previousSignificant(tree, significant).flatMap(SyntaxElement::tokenKind)
                        .filter(previous -> previous == TokenKind.BLOCK_BEGIN).isPresent())) {
            return keywordCompletions(prefix);
        }
        if (kind == TokenKind.LEFT_PAREN && isRefArgument(significant)) {
            return modelCompletions("", true);
        }
        if (OUTSIDE_EXPRESSIONS.contains(kind)) {
            return CompletionResponse.empty();
        }

        Optional<String> packageName = qualifyingPackage(tree, significant, prefix);
        if (packageName.isPresent()) {
            return packageMacroCompletions(packageName.get(), prefix);
        }
        return expressionCompletions(snapshot, prefix);
    }

    public HoverResponse hover(TextDocumentPositionRequest request) {
        DocumentSnapshot snapshot = documentService.get(request.uri());
        int offset = snapshot.positions().offset(request.line(), request.character());
        SyntaxTree tree = snapshot.result().tree();

        Optional<SyntaxElement> token = tokenUnder(tree, offset);
        if (token.isEmpty()) {
            return HoverResponse.none();
        }

        if (isModelString(token.get())) {
            String model = unquote(token.get().text());
            return projectService.index().model(model)
                    .map(path -> HoverResponse.of("Model `" + model + "`\n\n" + path))
                    .orElse(HoverResponse.none());
        }
        if (token.get().kind() != SyntaxKind.NAME) {
            return HoverResponse.none();
        }

        String name = macroName(token.get());
        Optional<MacroDefinition> local = snapshot.outline().macro(name);
        if (local.isPresent()) {
            return HoverResponse.of(macroHover(local.get(), snapshot.uri()));
        }
        Optional<ProjectMacro> project = projectService.index().macro(name);
        if (project.isPresent()) {
            return HoverResponse.of(macroHover(project.get().definition(), project.get().path().toString()));
        }
        return BUILTINS.stream()
                .filter(builtin -> builtin.name().equals(name))
                .findFirst()
                .map(builtin -> HoverResponse.of("```jinja\n" + builtin.signature() + "\n```\n\n"
                        + "dbt builtin, see " + builtin.documentation()))
                .orElse(HoverResponse.none());
    }

    public DefinitionResponse definition(TextDocumentPositionRequest request) {
        DocumentSnapshot snapshot = documentService.get(request.uri());
        int offset = snapshot.positions().offset(request.line(), request.character());
        SyntaxTree tree = snapshot.result().tree();

        Optional<SyntaxElement> token = tokenUnder(tree, offset);
        if (token.isEmpty()) {
            return DefinitionResponse.none();
        }

        if (isModelString(token.get())) {
            return projectService.index().model(unquote(token.get().text()))
                    .map(path -> DefinitionResponse.at(uri(path), 0, 0, 0, 0))
                    .orElse(DefinitionResponse.none());
        }
        if (token.get().kind() != SyntaxKind.NAME) {
            return DefinitionResponse.none();
        }

        String name = macroName(token.get());
        Optional<MacroDefinition> local = snapshot.outline().macro(name);
        if (local.isPresent()) {
            return location(snapshot.uri(), local.get().nameRange(), snapshot.positions());
        }
        Optional<ProjectMacro> project = projectService.index().macro(name);
        if (project.isPresent()) {
            return location(uri(project.get().path()), project.get().definition().nameRange(),
                    project.get().positions());
        }
        logger.debug("No definition found for '{}' in {}", name, request.uri());
        return DefinitionResponse.none();
    }

    private CompletionResponse modelCompletions(String prefix, boolean quoted) {
        List<CompletionItem> items = projectService.index().models().entrySet().stream()
                .filter(model -> model.getKey().startsWith(prefix))
                .sorted(Map.Entry.comparingByKey())
                .map(model -> new CompletionItem(
                        model.getKey(),
                        CompletionKind.MODEL,
                        model.getValue().toString(),
                        quoted ? "'" + model.getKey() + "'" : model.getKey()))
                .toList();
        return new CompletionResponse(items);
    }

    private static CompletionResponse keywordCompletions(String prefix) {
        return new CompletionResponse(BLOCK_KEYWORDS.stream()
                .filter(keyword -> keyword.startsWith(prefix))
                .map(keyword -> new CompletionItem(keyword, CompletionKind.KEYWORD, null, keyword))
                .toList());
    }

    private CompletionResponse packageMacroCompletions(String packageName, String prefix) {
        return new CompletionResponse(projectService.index().allMacros().stream()
                .filter(macro -> packageName.equals(macro.packageName()))
                .filter(macro -> macro.name().startsWith(prefix))
                .map(macro -> macroItem(macro.name(), macro.definition(), macro.qualifiedName()))
                .toList());
    }

    private CompletionResponse expressionCompletions(DocumentSnapshot snapshot, String prefix) {
        Map<String, CompletionItem> items = new LinkedHashMap<>();
        for (MacroDefinition macro : snapshot.outline().macros()) {
            items.putIfAbsent(macro.name(), macroItem(macro.name(), macro, macro.signature()));
        }
        for (ProjectMacro macro : projectService.index().allMacros()) {
            String label = macro.qualifiedName();
            items.putIfAbsent(label, macroItem(label, macro.definition(), macro.path().toString()));
        }
        for (Builtin builtin : BUILTINS) {
            items.putIfAbsent(builtin.name(), new CompletionItem(
                    builtin.name(), CompletionKind.BUILTIN, builtin.signature(), builtin.snippet()));
        }
        return new CompletionResponse(items.values().stream()
                .filter(item -> item.label().startsWith(prefix))
                .toList());
    }

    private static CompletionItem macroItem(String label, MacroDefinition macro, String detail) {
        List<String> required = macro.requiredArguments().stream().map(argument -> argument.name()).toList();
        List<String> placeholders = new ArrayList<>();
        for (int i = 0; i < required.size(); i++) {
            placeholders.add("${" + (i + 1) + ":" + required.get(i) + "}");
        }
        return new CompletionItem(label, CompletionKind.MACRO, detail,
                label + "(" + String.join(", ", placeholders) + ")");
    }

    private static String macroHover(MacroDefinition macro, String location) {
        return "```jinja\n{% macro " + macro.signature() + " %}\n```\n\nDefined in " + location;
    }

    private static DefinitionResponse location(String uri, TextRange range, PositionFinder positions) {
        Position start = positions.position(range.start());
        Position end = positions.position(range.end());
        return DefinitionResponse.at(uri, start.line(), start.character(), end.line(), end.character());
    }

    private static String uri(Path path) {
        return path.toUri().toString();
    }

    private static Optional<SyntaxElement> tokenBefore(SyntaxTree tree, int offset) {
        return offset > 0 ? tree.tokenAt(offset - 1) : Optional.empty();
    }

    /** The token under the cursor, or the one just before it when the cursor sits at a token's end. */
    private static Optional<SyntaxElement> tokenUnder(SyntaxTree tree, int offset) {
        Optional<SyntaxElement> under = tree.tokenAt(offset);
        if (under.isPresent() && (under.get().kind() == SyntaxKind.NAME || isModelString(under.get()))) {
            return under;
        }
        Optional<SyntaxElement> before = tokenBefore(tree, offset);
        return before.isPresent() ? before : under;
    }

    private static SyntaxElement skipWhitespaceBackwards(SyntaxTree tree, SyntaxElement token) {
        SyntaxElement current = token;
        while (current.tokenKind().filter(kind -> kind == TokenKind.WHITESPACE).isPresent()) {
            Optional<SyntaxElement> previous = tokenBefore(tree, current.range().start());
            if (previous.isEmpty()) {
                break;
            }
            current = previous.get();
        }
        return current;
    }

    private static Optional<SyntaxElement> previousSignificant(SyntaxTree tree, SyntaxElement token) {
        return tokenBefore(tree, token.range().start()).map(previous -> skipWhitespaceBackwards(tree, previous));
    }

    private static String namePrefix(SyntaxElement token, int offset) {
        if (token.kind() != SyntaxKind.NAME || offset > token.range().end()) {
            return "";
        }
        return token.text().substring(0, offset - token.range().start());
    }

    /** For {@code pkg.} or {@code pkg.partial} under the cursor, the name of {@code pkg}. */
    private static Optional<String> qualifyingPackage(SyntaxTree tree, SyntaxElement token, String prefix) {
        SyntaxElement dot = token;
        if (!prefix.isEmpty()) {
            Optional<SyntaxElement> previous = previousSignificant(tree, token);
            if (previous.isEmpty()) {
                return Optional.empty();
            }
            dot = previous.get();
        }
        if (dot.kind() != SyntaxKind.DOT) {
            return Optional.empty();
        }
        return previousSignificant(tree, dot)
                .filter(owner -> owner.kind() == SyntaxKind.NAME)
                .map(SyntaxElement::text);
    }

    /** Text typed so far inside a string literal ending at or after the cursor. */
    private static Optional<String> openStringPrefix(SyntaxElement token, int offset) {
        String text = token.text();
        boolean string = token.kind() == SyntaxKind.STRING_LITERAL
                || (token.isError() && token.isToken() && (text.startsWith("'") || text.startsWith("\"")));
        if (!string) {
            return Optional.empty();
        }
        int typed = offset - token.range().start();
        boolean closed = token.kind() == SyntaxKind.STRING_LITERAL && typed >= text.length();
        if (closed || typed < 1) {
            return Optional.empty();
        }
        return Optional.of(text.substring(1, typed));
    }

    /** Whether the element is part of the argument list of a {@code ref(...)} call. */
    private static boolean isRefArgument(SyntaxElement element) {
        for (SyntaxElement ancestor : element.ancestors()) {
            if (ancestor.kind() == SyntaxKind.CALL_ARGUMENTS) {
                return ancestor.parent()
                        .flatMap(call -> call.childNodes().stream().findFirst())
                        .filter(callee -> callee.kind() == SyntaxKind.EXPR_NAME && callee.text().equals("ref"))
                        .isPresent();
            }
        }
        return false;
    }

    private static boolean isModelString(SyntaxElement token) {
        return token.kind() == SyntaxKind.STRING_LITERAL && isRefArgument(token);
    }

    /** {@code pkg.macro} when the name is the attribute of a package access, the bare name otherwise. */
    private static String macroName(SyntaxElement name) {
        return name.parent()
                .filter(parent -> parent.kind() == SyntaxKind.EXPR_GET_ATTR)
                .flatMap(access -> access.firstChild(SyntaxKind.EXPR_NAME))
                .map(owner -> owner.text().strip() + "." + name.text())
                .orElse(name.text());
    }

    private static String unquote(String literal) {
        return literal.length() >= 2 ? literal.substring(1, literal.length() - 1) : literal;
    }
}
