package com.dbtide.backend.text;

import java.util.Arrays;

/**
 * Converts between source offsets and line/character positions.
 *
 * <p>Lines end at {@code \n}, {@code \r\n} or a lone {@code \r}. Positions past the end of a line or of the
 * document are clamped.
 */
public final class PositionFinder {

    private final String text;
    private final int length;
    private final int[] lineStarts;

    public PositionFinder(String text) {
        this.text = text;
        this.length = text.length();
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                i++;
            }
            if (c == '\n' || c == '\r') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public Position position(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        int line = Arrays.binarySearch(lineStarts, clamped);
        if (line < 0) {
            line = -line - 2;
        }
        return new Position(line, clamped - lineStarts[line]);
    }

    public int offset(Position position) {
        return offset(position.line(), position.character());
    }

    public int offset(int line, int character) {
        if (line < 0) {
            return 0;
        }
        if (line >= lineStarts.length) {
            return length;
        }
        int lineEnd = line + 1 < lineStarts.length ? lineStarts[line + 1] : length;
        while (lineEnd > lineStarts[line] && isLineBreak(text.charAt(lineEnd - 1))) {
            lineEnd--;
        }
        return Math.min(lineStarts[line] + Math.max(0, character), lineEnd);
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }
}
