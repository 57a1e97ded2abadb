package com.dbtide.backend.syntax;

/**
 * Maps offsets into a Java string (UTF-16 code units) to offsets into its UTF-8 encoding.
 *
 * <p>Pure ASCII text needs no table since both offsets coincide. An unpaired surrogate counts as three
 * bytes, the width of its generalized UTF-8 encoding.
 */
final class Utf8Offsets {

    private final int length;
    private final int[] bytes;

    private Utf8Offsets(int length, int[] bytes) {
        this.length = length;
        this.bytes = bytes;
    }

    static Utf8Offsets of(String text) {
        int length = text.length();
        int firstWide = 0;
        while (firstWide < length && text.charAt(firstWide) < 0x80) {
            firstWide++;
        }
        if (firstWide == length) {
            return new Utf8Offsets(length, null);
        }
        int[] bytes = new int[length + 1];
        for (int i = 1; i <= firstWide; i++) {
            bytes[i] = i;
        }
        int i = firstWide;
        while (i < length) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < length && Character.isLowSurrogate(text.charAt(i + 1))) {
                // the low half sits inside the four-byte sequence
                bytes[i + 1] = bytes[i] + 4;
                bytes[i + 2] = bytes[i] + 4;
                i += 2;
                continue;
            }
            int width = c < 0x80 ? 1 : c < 0x800 ? 2 : 3;
            bytes[i + 1] = bytes[i] + width;
            i++;
        }
        return new Utf8Offsets(length, bytes);
    }

    int byteOffset(int offset) {
        if (offset < 0 || offset > length) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside [0, " + length + "]");
        }
        return bytes == null ? offset : bytes[offset];
    }
}
