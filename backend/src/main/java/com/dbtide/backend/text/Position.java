package com.dbtide.backend.text;

/** Zero-based line and character, the character counted in UTF-16 code units. */
public record Position(int line, int character) {
}
