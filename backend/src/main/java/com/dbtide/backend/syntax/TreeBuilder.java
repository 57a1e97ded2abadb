package com.dbtide.backend.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Accumulates tokens and node boundaries bottom-up into the flat tables of a {@link SyntaxTree}.
 *
 * <p>Elements receive their index when they are complete: tokens when added, nodes when finished.
 * {@link #checkpoint()} and {@link #startNodeAt(int, SyntaxKind)} let the parser wrap already-built
 * elements in a new parent, which is how left operands end up inside binary expression nodes.
 */
final class TreeBuilder {

    private record Frame(SyntaxKind kind, int firstChild, int startOffset) {
    }

    private final List<Frame> open = new ArrayList<>();
    private int[] pending = new int[64];
    private int pendingSize;

    private int[] kinds = new int[256];
    private int[] tokenKinds = new int[256];
    private int[] starts = new int[256];
    private int[] ends = new int[256];
    private int[] childOffsets = new int[256];
    private int[] childCounts = new int[256];
    private int size;

    private int[] children = new int[256];
    private int childrenSize;

    private int offset;

    int checkpoint() {
        return pendingSize;
    }

    void startNode(SyntaxKind kind) {
        open.add(new Frame(kind, pendingSize, offset));
    }

    void startNodeAt(int checkpoint, SyntaxKind kind) {
        if (!open.isEmpty() && checkpoint < open.get(open.size() - 1).firstChild()) {
            throw new IllegalStateException("checkpoint " + checkpoint + " precedes the innermost open node");
        }
        int startOffset = checkpoint < pendingSize ? starts[pending[checkpoint]] : offset;
        open.add(new Frame(kind, checkpoint, startOffset));
    }

    void token(Token token, SyntaxKind kind) {
        int index = allocate(kind, token.kind().ordinal(), token.range().start(), token.range().end());
        childOffsets[index] = 0;
        childCounts[index] = 0;
        push(index);
        offset = token.range().end();
    }

    void finishNode() {
        Frame frame = open.get(open.size() - 1);
        finishNode(frame.kind());
    }

    /** Finishes the innermost node, replacing the kind it was started with. */
    void finishNode(SyntaxKind kind) {
        Frame frame = open.remove(open.size() - 1);
        int count = pendingSize - frame.firstChild();
        int start = count > 0 ? starts[pending[frame.firstChild()]] : frame.startOffset();
        int end = count > 0 ? ends[pending[pendingSize - 1]] : frame.startOffset();
        int index = allocate(kind, -1, start, end);

        ensureChildren(childrenSize + count);
        System.arraycopy(pending, frame.firstChild(), children, childrenSize, count);
        childOffsets[index] = childrenSize;
        childCounts[index] = count;
        childrenSize += count;

        pendingSize = frame.firstChild();
        push(index);
    }

    SyntaxTree finish(String source) {
        if (!open.isEmpty() || pendingSize != 1) {
            throw new IllegalStateException("unbalanced tree: " + open.size() + " open nodes, " + pendingSize + " roots");
        }
        int root = pending[0];
        int[] parents = new int[size];
        int[] slots = new int[size];
        parents[root] = -1;
        for (int node = 0; node < size; node++) {
            for (int i = 0; i < childCounts[node]; i++) {
                int child = children[childOffsets[node] + i];
                parents[child] = node;
                slots[child] = i;
            }
        }
        return new SyntaxTree(
                source,
                root,
                Arrays.copyOf(kinds, size),
                Arrays.copyOf(tokenKinds, size),
                Arrays.copyOf(starts, size),
                Arrays.copyOf(ends, size),
                parents,
                slots,
                Arrays.copyOf(childOffsets, size),
                Arrays.copyOf(childCounts, size),
                Arrays.copyOf(children, childrenSize));
    }

    private int allocate(SyntaxKind kind, int tokenKind, int start, int end) {
        if (size == kinds.length) {
            int capacity = size * 2;
            kinds = Arrays.copyOf(kinds, capacity);
            tokenKinds = Arrays.copyOf(tokenKinds, capacity);
            starts = Arrays.copyOf(starts, capacity);
            ends = Arrays.copyOf(ends, capacity);
            childOffsets = Arrays.copyOf(childOffsets, capacity);
            childCounts = Arrays.copyOf(childCounts, capacity);
        }
        kinds[size] = kind.ordinal();
        tokenKinds[size] = tokenKind;
        starts[size] = start;
        ends[size] = end;
        return size++;
    }

    private void push(int index) {
        if (pendingSize == pending.length) {
            pending = Arrays.copyOf(pending, pendingSize * 2);
        }
        pending[pendingSize++] = index;
    }

    private void ensureChildren(int capacity) {
        if (capacity > children.length) {
            children = Arrays.copyOf(children, Math.max(capacity, children.length * 2));
        }
    }
}
