package com.dbtide.backend.syntax;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Renders a tree as an indented text dump, one element per line:
 *
 * <pre>
 * TEMPLATE@0..9
 *   VARIABLE@0..9
 *     VARIABLE_BEGIN@0..2 "{{"
 *     WHITESPACE@2..3 " "
 *     ...
 * </pre>
 *
 * Ranges are byte offsets into the UTF-8 encoding of the source. Error nodes and tokens are prefixed
 * with {@code !!}. Rendering has no side effects and the same tree
 * always gives the same text.
 */
public final class TreeRenderer {

    private static final String ERROR_MARK = "!!";

    private TreeRenderer() {
    }

    public static String render(SyntaxTree tree) {
        StringBuilder out = new StringBuilder();
        appendTree(tree, out);
        return out.toString();
    }

    /** The tree dump followed, when there are any, by an {@code errors:} section. */
    public static String render(ParseResult result) {
        StringBuilder out = new StringBuilder();
        appendTree(result.tree(), out);
        List<ParseError> errors = result.errors();
        if (!errors.isEmpty()) {
            out.append("errors:\n");
            for (ParseError error : errors) {
                out.append("  ").append(error.category()).append(' ')
                        .append(result.tree().byteRange(error.range())).append(": ")
                        .append(error.message()).append('\n');
            }
        }
        return out.toString();
    }

    private record Entry(SyntaxElement element, int depth) {
    }

    private static void appendTree(SyntaxTree tree, StringBuilder out) {
        Deque<Entry> pending = new ArrayDeque<>();
        pending.push(new Entry(tree.root(), 0));
        while (!pending.isEmpty()) {
            Entry entry = pending.pop();
            appendLine(entry.element(), entry.depth(), out);
            List<SyntaxElement> children = entry.element().children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(new Entry(children.get(i), entry.depth() + 1));
            }
        }
    }

    private static void appendLine(SyntaxElement element, int depth, StringBuilder out) {
        out.append("  ".repeat(depth));
        if (element.isError()) {
            out.append(ERROR_MARK);
        }
        out.append(element.kind()).append('@').append(element.byteRange());
        if (element.isToken()) {
            out.append(' ');
            appendQuoted(element.text(), out);
        }
        out.append('\n');
    }

    private static void appendQuoted(String text, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                default -> out.append(c);
            }
        }
        out.append('"');
    }
}
