package com.dbtide.backend.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of one node or token of a {@link SyntaxTree}.
 *
 * <p>Views are cheap value objects; two views are equal when they point at the same element of the same tree.
 */
public final class SyntaxElement {

    private final SyntaxTree tree;
    private final int index;

    SyntaxElement(SyntaxTree tree, int index) {
        this.tree = tree;
        this.index = index;
    }

    public SyntaxTree tree() {
        return tree;
    }

    public SyntaxKind kind() {
        return tree.kind(index);
    }

    /** The lexer's kind for a token, empty for a node. */
    public Optional<TokenKind> tokenKind() {
        return isToken() ? Optional.of(tree.tokenKind(index)) : Optional.empty();
    }

    public boolean isToken() {
        return tree.isToken(index);
    }

    public boolean isNode() {
        return !isToken();
    }

    public boolean isTrivia() {
        return isToken() && tree.tokenKind(index).isTrivia();
    }

    public boolean isError() {
        return kind() == SyntaxKind.ERROR;
    }

    /** Range in string offsets (UTF-16 code units), the unit of {@link #tokenAt(int)}. */
    public TextRange range() {
        return new TextRange(tree.start(index), tree.end(index));
    }

    /** Range in offsets into the UTF-8 encoding of the source. */
    public TextRange byteRange() {
        return tree.byteRange(range());
    }

    /** Source text of this element, rebuilt from the texts of the tokens below it. */
    public String text() {
        if (isToken()) {
            return tree.source().substring(tree.start(index), tree.end(index));
        }
        StringBuilder text = new StringBuilder(tree.end(index) - tree.start(index));
        for (SyntaxElement token : tokens()) {
            text.append(tree.source(), tree.start(token.index), tree.end(token.index));
        }
        return text.toString();
    }

    public List<SyntaxElement> children() {
        int count = tree.childCount(index);
        if (count == 0) {
            return Collections.emptyList();
        }
        List<SyntaxElement> children = new ArrayList<>(count);
        for (int slot = 0; slot < count; slot++) {
            children.add(new SyntaxElement(tree, tree.child(index, slot)));
        }
        return children;
    }

    public List<SyntaxElement> childNodes() {
        return children().stream().filter(SyntaxElement::isNode).toList();
    }

    public Optional<SyntaxElement> firstChild(SyntaxKind kind) {
        return children().stream().filter(child -> child.kind() == kind).findFirst();
    }

    public List<SyntaxElement> childrenOfKind(SyntaxKind kind) {
        return children().stream().filter(child -> child.kind() == kind).toList();
    }

    public Optional<SyntaxElement> parent() {
        int parent = tree.parent(index);
        return parent < 0 ? Optional.empty() : Optional.of(new SyntaxElement(tree, parent));
    }

    /** Ancestors from the parent up to the root. */
    public List<SyntaxElement> ancestors() {
        List<SyntaxElement> ancestors = new ArrayList<>();
        for (int parent = tree.parent(index); parent >= 0; parent = tree.parent(parent)) {
            ancestors.add(new SyntaxElement(tree, parent));
        }
        return ancestors;
    }

    /** Nearest statement node containing this element. */
    public Optional<SyntaxElement> enclosingBlock() {
        return ancestors().stream().filter(ancestor -> ancestor.kind().isStatement()).findFirst();
    }

    /** This element and everything below it, in source order. */
    public List<SyntaxElement> descendants() {
        List<SyntaxElement> result = new ArrayList<>();
        collect(index, result, false);
        return result;
    }

    public List<SyntaxElement> tokens() {
        List<SyntaxElement> result = new ArrayList<>();
        collect(index, result, true);
        return result;
    }

    private void collect(int element, List<SyntaxElement> result, boolean tokensOnly) {
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(element);
        while (!pending.isEmpty()) {
            int next = pending.pop();
            if (!tokensOnly || tree.isToken(next)) {
                result.add(new SyntaxElement(tree, next));
            }
            for (int slot = tree.childCount(next) - 1; slot >= 0; slot--) {
                pending.push(tree.child(next, slot));
            }
        }
    }

    public Optional<SyntaxElement> previousSibling() {
        return sibling(-1);
    }

    public Optional<SyntaxElement> nextSibling() {
        return sibling(1);
    }

    /** Closest preceding sibling that is neither trivia nor a comment. */
    public Optional<SyntaxElement> previousMeaningfulSibling() {
        return meaningfulSibling(-1);
    }

    /** Closest following sibling that is neither trivia nor a comment. */
    public Optional<SyntaxElement> nextMeaningfulSibling() {
        return meaningfulSibling(1);
    }

    private Optional<SyntaxElement> sibling(int step) {
        int parent = tree.parent(index);
        if (parent < 0) {
            return Optional.empty();
        }
        int slot = tree.slot(index) + step;
        if (slot < 0 || slot >= tree.childCount(parent)) {
            return Optional.empty();
        }
        return Optional.of(new SyntaxElement(tree, tree.child(parent, slot)));
    }

    private Optional<SyntaxElement> meaningfulSibling(int step) {
        int parent = tree.parent(index);
        if (parent < 0) {
            return Optional.empty();
        }
        for (int slot = tree.slot(index) + step; slot >= 0 && slot < tree.childCount(parent); slot += step) {
            SyntaxElement candidate = new SyntaxElement(tree, tree.child(parent, slot));
            if (!candidate.isTrivia() && candidate.kind() != SyntaxKind.COMMENT) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Token whose range contains {@code offset}, found by descending through the children whose ranges
     * contain it. Empty when the offset lies outside this element.
     */
    public Optional<SyntaxElement> tokenAt(int offset) {
        if (!range().contains(offset)) {
            return Optional.empty();
        }
        int element = index;
        while (!tree.isToken(element)) {
            int slot = lastChildStartingAtOrBefore(element, offset);
            if (slot < 0) {
                return Optional.empty();
            }
            int child = tree.child(element, slot);
            if (offset >= tree.end(child)) {
                return Optional.empty();
            }
            element = child;
        }
        return Optional.of(new SyntaxElement(tree, element));
    }

    private int lastChildStartingAtOrBefore(int element, int offset) {
        int low = 0;
        int high = tree.childCount(element) - 1;
        int found = -1;
        while (low <= high) {
            int middle = (low + high) >>> 1;
            if (tree.start(tree.child(element, middle)) <= offset) {
                found = middle;
                low = middle + 1;
            } else {
                high = middle - 1;
            }
        }
        return found;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SyntaxElement element)) {
            return false;
        }
        return tree == element.tree && index == element.index;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(tree), index);
    }

    @Override
    public String toString() {
        return kind() + "@" + range();
    }
}
