package com.dbtide.backend.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits template text into a gapless token sequence.
 *
 * <p>Text outside of {@code {{ }}}, {@code {% %}} and {@code {# #}} markers is a single {@link TokenKind#DATA}
 * token per run. A {@code {% raw %}} block is kept opaque: its body is one {@code DATA} token whatever it
 * contains. Characters matching no rule become one-character {@link TokenKind#ERROR} tokens, so tokenizing
 * never fails and the tokens always cover the whole input.
 */
public final class Lexer {

    private static final Pattern RAW_BEGIN = Pattern.compile("\\{%[-+]?\\s*raw\\s*-?%}");
    private static final Pattern RAW_END = Pattern.compile("\\{%[-+]?\\s*endraw\\s*-?%}");

    private enum Context {
        VARIABLE("}}", TokenKind.VARIABLE_END),
        BLOCK("%}", TokenKind.BLOCK_END);

        private final String endMarker;
        private final TokenKind endKind;

        Context(String endMarker, TokenKind endKind) {
            this.endMarker = endMarker;
            this.endKind = endKind;
        }
    }

    private final String source;
    private final int length;
    private final List<Token> tokens = new ArrayList<>();
    private int position;

    private Lexer(String source) {
        this.source = source;
        this.length = source.length();
    }

    public static List<Token> tokenize(String source) {
        Lexer lexer = new Lexer(source);
        lexer.lexTemplate();
        return List.copyOf(lexer.tokens);
    }

    private void lexTemplate() {
        while (position < length) {
            int markerStart = findBeginMarker(position);
            if (markerStart < 0) {
                emit(TokenKind.DATA, length);
                return;
            }
            if (markerStart > position) {
                emit(TokenKind.DATA, markerStart);
            }
            char second = source.charAt(markerStart + 1);
            if (second == '#') {
                lexComment();
            } else if (second == '{') {
                emit(TokenKind.VARIABLE_BEGIN, afterBeginMarker(markerStart));
                lexContext(Context.VARIABLE);
            } else if (!lexRaw()) {
                emit(TokenKind.BLOCK_BEGIN, afterBeginMarker(markerStart));
                lexContext(Context.BLOCK);
            }
        }
    }

    private int findBeginMarker(int from) {
        int index = source.indexOf('{', from);
        while (index >= 0 && index + 1 < length) {
            if (isBeginMarker(index)) {
                return index;
            }
            index = source.indexOf('{', index + 1);
        }
        return -1;
    }

    private boolean isBeginMarker(int index) {
        if (index + 1 >= length || source.charAt(index) != '{') {
            return false;
        }
        char next = source.charAt(index + 1);
        return next == '{' || next == '%' || next == '#';
    }

    private int afterBeginMarker(int markerStart) {
        int end = markerStart + 2;
        if (end < length && (source.charAt(end) == '-' || source.charAt(end) == '+')) {
            end++;
        }
        return end;
    }

    private boolean lexRaw() {
        Matcher begin = RAW_BEGIN.matcher(source).region(position, length);
        if (!begin.lookingAt()) {
            return false;
        }
        emit(TokenKind.RAW_BEGIN, begin.end());
        Matcher end = RAW_END.matcher(source);
        if (!end.find(position)) {
            emit(TokenKind.DATA, length);
            return true;
        }
        if (end.start() > position) {
            emit(TokenKind.DATA, end.start());
        }
        emit(TokenKind.RAW_END, end.end());
        return true;
    }

    private void lexComment() {
        emit(TokenKind.COMMENT_BEGIN, afterBeginMarker(position));
        int close = source.indexOf("#}", position);
        if (close < 0) {
            emit(TokenKind.COMMENT_DATA, length);
            return;
        }
        int markerStart = close > position && source.charAt(close - 1) == '-' ? close - 1 : close;
        if (markerStart > position) {
            emit(TokenKind.COMMENT_DATA, markerStart);
        }
        emit(TokenKind.COMMENT_END, close + 2);
    }

    private void lexContext(Context context) {
        Deque<Character> brackets = new ArrayDeque<>();
        while (position < length) {
            int endMarker = endMarkerAt(context, brackets);
            if (endMarker > 0) {
                emit(context.endKind, endMarker);
                return;
            }
            if (brackets.isEmpty() && isBeginMarker(position)) {
                // unterminated context; the next one starts here
                return;
            }
            char c = source.charAt(position);
            if (Character.isWhitespace(c)) {
                lexWhitespace();
            } else if (Character.isLetter(c) || c == '_') {
                lexName();
            } else if (isDigit(c)) {
                lexNumber();
            } else if (c == '\'' || c == '"') {
                lexString(c);
            } else {
                lexOperator(brackets);
            }
        }
    }

    /** Returns the end offset of the context's end marker at the current position, or -1. */
    private int endMarkerAt(Context context, Deque<Character> brackets) {
        if (context == Context.VARIABLE && !brackets.isEmpty() && brackets.peek() == '{') {
            return -1;
        }
        int start = position;
        if (source.charAt(start) == '-') {
            start++;
        }
        return source.startsWith(context.endMarker, start) ? start + context.endMarker.length() : -1;
    }

    private void lexWhitespace() {
        int end = position;
        while (end < length && Character.isWhitespace(source.charAt(end))) {
            end++;
        }
        emit(TokenKind.WHITESPACE, end);
    }

    private void lexName() {
        int end = position + 1;
        while (end < length && (Character.isLetterOrDigit(source.charAt(end)) || source.charAt(end) == '_')) {
            end++;
        }
        emit(TokenKind.NAME, end);
    }

    private void lexNumber() {
        int end = skipDigits(position);
        TokenKind kind = TokenKind.INTEGER_LITERAL;
        if (end + 1 < length && source.charAt(end) == '.' && isDigit(source.charAt(end + 1))) {
            end = skipDigits(end + 1);
            kind = TokenKind.FLOAT_LITERAL;
        }
        if (end < length && (source.charAt(end) == 'e' || source.charAt(end) == 'E')) {
            int exponent = end + 1;
            if (exponent < length && (source.charAt(exponent) == '+' || source.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < length && isDigit(source.charAt(exponent))) {
                end = skipDigits(exponent);
                kind = TokenKind.FLOAT_LITERAL;
            }
        }
        emit(kind, end);
    }

    private int skipDigits(int from) {
        int end = from;
        while (end < length) {
            char c = source.charAt(end);
            if (isDigit(c) || (c == '_' && end + 1 < length && isDigit(source.charAt(end + 1)))) {
                end++;
            } else {
                break;
            }
        }
        return end;
    }

    private void lexString(char quote) {
        int end = position + 1;
        while (end < length) {
            char c = source.charAt(end);
            if (c == '\\') {
                end += 2;
            } else if (c == quote) {
                emit(TokenKind.STRING_LITERAL, end + 1);
                return;
            } else {
                end++;
            }
        }
        emit(TokenKind.ERROR, position + 1);
    }

    private void lexOperator(Deque<Character> brackets) {
        for (int size = Math.min(KindTable.maxSymbolLength(), length - position); size > 0; size--) {
            TokenKind kind = KindTable.symbol(source.substring(position, position + size));
            if (kind != TokenKind.ERROR) {
                trackBracket(kind, brackets);
                emit(kind, position + size);
                return;
            }
        }
        emit(TokenKind.ERROR, position + Character.charCount(source.codePointAt(position)));
    }

    private static void trackBracket(TokenKind kind, Deque<Character> brackets) {
        switch (kind) {
            case LEFT_PAREN -> brackets.push('(');
            case LEFT_BRACKET -> brackets.push('[');
            case LEFT_BRACE -> brackets.push('{');
            case RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE -> brackets.poll();
            default -> {
            }
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void emit(TokenKind kind, int end) {
        tokens.add(new Token(kind, position, end));
        position = end;
    }
}
