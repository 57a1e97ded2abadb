package com.dbtide.backend.syntax;

/** Half-open interval {@code [start, end)} of offsets into the source text. */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range [" + start + ", " + end + ")");
        }
    }

    public static TextRange empty(int offset) {
        return new TextRange(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public boolean contains(TextRange other) {
        return other.start >= start && other.end <= end;
    }

    public boolean intersects(TextRange other) {
        return other.start < end && start < other.end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
