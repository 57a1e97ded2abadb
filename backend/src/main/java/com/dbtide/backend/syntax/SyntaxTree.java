package com.dbtide.backend.syntax;

import java.util.Optional;

/**
 * Immutable concrete syntax tree over a template's full text.
 *
 * <p>Elements live in parallel arrays and refer to each other by index, so parent links never form
 * ownership cycles and a tree can be shared freely between threads once built. Use {@link #root()} to
 * obtain {@link SyntaxElement} views for querying.
 */
public final class SyntaxTree {

    private final String source;
    private final int root;
    private final int[] kinds;
    private final int[] tokenKinds;
    private final int[] starts;
    private final int[] ends;
    private final int[] parents;
    private final int[] slots;
    private final int[] childOffsets;
    private final int[] childCounts;
    private final int[] children;
    private volatile Utf8Offsets utf8;

    SyntaxTree(String source, int root, int[] kinds, int[] tokenKinds, int[] starts, int[] ends,
            int[] parents, int[] slots, int[] childOffsets, int[] childCounts, int[] children) {
        this.source = source;
        this.root = root;
        this.kinds = kinds;
        this.tokenKinds = tokenKinds;
        this.starts = starts;
        this.ends = ends;
        this.parents = parents;
        this.slots = slots;
        this.childOffsets = childOffsets;
        this.childCounts = childCounts;
        this.children = children;
    }

    public String source() {
        return source;
    }

    public SyntaxElement root() {
        return new SyntaxElement(this, root);
    }

    /** Number of elements (nodes and tokens) in the tree. */
    public int size() {
        return kinds.length;
    }

    public Optional<SyntaxElement> tokenAt(int offset) {
        return root().tokenAt(offset);
    }

    /** Offset into the UTF-8 encoding of the source for a string offset. */
    public int byteOffset(int offset) {
        Utf8Offsets offsets = utf8;
        if (offsets == null) {
            offsets = Utf8Offsets.of(source);
            utf8 = offsets;
        }
        return offsets.byteOffset(offset);
    }

    public TextRange byteRange(TextRange range) {
        return new TextRange(byteOffset(range.start()), byteOffset(range.end()));
    }

    SyntaxKind kind(int element) {
        return KindTable.syntaxKind(kinds[element]);
    }

    boolean isToken(int element) {
        return tokenKinds[element] >= 0;
    }

    TokenKind tokenKind(int element) {
        return KindTable.tokenKind(tokenKinds[element]);
    }

    int start(int element) {
        return starts[element];
    }

    int end(int element) {
        return ends[element];
    }

    int parent(int element) {
        return parents[element];
    }

    int slot(int element) {
        return slots[element];
    }

    int childCount(int element) {
        return childCounts[element];
    }

    int child(int element, int slot) {
        return children[childOffsets[element] + slot];
    }
}
