package com.dbtide.backend.outline;

import com.dbtide.backend.syntax.SyntaxElement;
import com.dbtide.backend.syntax.SyntaxKind;
import com.dbtide.backend.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Definitions and references found in one template, read off its syntax tree.
 *
 * <p>Extraction is purely syntactic. Blocks that were left unclosed are still outlined, from their start
 * marker, so a definition being typed stays visible to completion and hover.
 */
public final class TemplateOutline {

    private static final TemplateOutline EMPTY = new TemplateOutline(List.of(), List.of(), List.of());

    private final List<MacroDefinition> macros;
    private final List<BlockDefinition> blocks;
    private final List<ReferenceCall> references;

    private TemplateOutline(List<MacroDefinition> macros, List<BlockDefinition> blocks,
            List<ReferenceCall> references) {
        this.macros = List.copyOf(macros);
        this.blocks = List.copyOf(blocks);
        this.references = List.copyOf(references);
    }

    public static TemplateOutline empty() {
        return EMPTY;
    }

    public static TemplateOutline of(SyntaxTree tree) {
        List<MacroDefinition> macros = new ArrayList<>();
        List<BlockDefinition> blocks = new ArrayList<>();
        List<ReferenceCall> references = new ArrayList<>();
        for (SyntaxElement element : tree.root().descendants()) {
            switch (element.kind()) {
                case MACRO_BLOCK_START -> macro(element).ifPresent(macros::add);
                case MATERIALIZATION_BLOCK_START -> block(SyntaxKind.STMT_MATERIALIZATION, element).ifPresent(blocks::add);
                case DOCS_BLOCK_START -> block(SyntaxKind.STMT_DOCS, element).ifPresent(blocks::add);
                case SNAPSHOT_BLOCK_START -> block(SyntaxKind.STMT_SNAPSHOT, element).ifPresent(blocks::add);
                case TEST_BLOCK_START -> {
                    macro(element).ifPresent(macros::add);
                    block(SyntaxKind.STMT_TEST, element).ifPresent(blocks::add);
                }
                case EXPR_CALL -> reference(element).ifPresent(references::add);
                default -> {
                }
            }
        }
        return new TemplateOutline(macros, blocks, references);
    }

    public List<MacroDefinition> macros() {
        return macros;
    }

    public List<BlockDefinition> blocks() {
        return blocks;
    }

    public List<ReferenceCall> references() {
        return references;
    }

    public Optional<MacroDefinition> macro(String name) {
        return macros.stream().filter(macro -> macro.name().equals(name)).findFirst();
    }

    private static Optional<MacroDefinition> macro(SyntaxElement start) {
        Optional<SyntaxElement> name = definedName(start);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        List<MacroArgument> arguments = new ArrayList<>();
        start.firstChild(SyntaxKind.SIGNATURE).ifPresent(signature -> {
            for (SyntaxElement argument : signature.childNodes()) {
                Optional<SyntaxElement> argumentName = argument.firstChild(SyntaxKind.NAME);
                if (argumentName.isEmpty()) {
                    continue;
                }
                if (argument.kind() == SyntaxKind.SIGNATURE_ARG) {
                    arguments.add(new MacroArgument(argumentName.get().text(), null));
                } else if (argument.kind() == SyntaxKind.SIGNATURE_DEFAULT_ARG) {
                    String defaultValue = argument.childNodes().stream()
                            .findFirst()
                            .map(SyntaxElement::text)
                            .orElse("");
                    arguments.add(new MacroArgument(argumentName.get().text(), defaultValue));
                }
            }
        });
        SyntaxElement definition = start.parent().orElse(start);
        return Optional.of(new MacroDefinition(name.get().text(), name.get().range(), definition.range(), arguments));
    }

    private static Optional<BlockDefinition> block(SyntaxKind kind, SyntaxElement start) {
        SyntaxElement definition = start.parent().orElse(start);
        return definedName(start)
                .map(name -> new BlockDefinition(kind, name.text(), name.range(), definition.range()));
    }

    /** The name following the opening keyword of a start marker. */
    private static Optional<SyntaxElement> definedName(SyntaxElement start) {
        List<SyntaxElement> names = start.childrenOfKind(SyntaxKind.NAME);
        return names.size() < 2 ? Optional.empty() : Optional.of(names.get(1));
    }

    private static Optional<ReferenceCall> reference(SyntaxElement call) {
        List<SyntaxElement> parts = call.childNodes();
        if (parts.size() < 2 || parts.get(0).kind() != SyntaxKind.EXPR_NAME
                || parts.get(1).kind() != SyntaxKind.CALL_ARGUMENTS) {
            return Optional.empty();
        }
        String function = parts.get(0).text();
        if (!function.equals("ref") && !function.equals("source")) {
            return Optional.empty();
        }
        List<String> arguments = new ArrayList<>();
        for (SyntaxElement argument : parts.get(1).childrenOfKind(SyntaxKind.CALL_STATIC_ARG)) {
            Optional<SyntaxElement> value = argument.firstChild(SyntaxKind.EXPR_CONSTANT_STRING);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            arguments.add(stringValue(value.get()));
        }
        return Optional.of(new ReferenceCall(function, arguments, call.range()));
    }

    /** Value of a string constant: each literal unquoted and unescaped, adjacent literals joined. */
    public static String stringValue(SyntaxElement constant) {
        StringBuilder value = new StringBuilder();
        for (SyntaxElement token : constant.tokens()) {
            if (token.kind() != SyntaxKind.STRING_LITERAL) {
                continue;
            }
            String literal = token.text();
            for (int i = 1; i < literal.length() - 1; i++) {
                char c = literal.charAt(i);
                if (c == '\\' && i + 1 < literal.length() - 1) {
                    char escaped = literal.charAt(++i);
                    value.append(switch (escaped) {
                        case 'n' -> '\n';
                        case 't' -> '\t';
                        case 'r' -> '\r';
                        default -> escaped;
                    });
                } else {
                    value.append(c);
                }
            }
        }
        return value.toString();
    }
}
