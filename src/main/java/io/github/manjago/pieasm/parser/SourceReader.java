package io.github.manjago.pieasm.parser;

import org.jetbrains.annotations.NotNull;

/**
 * Character cursor over source text with line/column tracking and backtracking.
 */
final class SourceReader {

    /** Saved cursor position. */
    record Mark(int pos, int line, int column) {}

    private final String text;
    private int pos;
    private int line = 1;
    private int column = 1;

    SourceReader(@NotNull String text) {
        this.text = text;
    }

    boolean atEnd() {
        return pos >= text.length();
    }

    /** Current character, or {@code '\0'} at end of input. */
    char peek() {
        return atEnd() ? '\0' : text.charAt(pos);
    }

    char next() {
        char c = text.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    boolean accept(char expected) {
        if (!atEnd() && peek() == expected) {
            next();
            return true;
        }
        return false;
    }

    /**
     * Skip whitespace (newlines included) and {@code ;} comments.
     */
    void skipTrivia() {
        while (!atEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                next();
            } else if (c == ';') {
                while (!atEnd() && peek() != '\n') {
                    next();
                }
            } else {
                return;
            }
        }
    }

    /** Consume a run of ASCII letters (may be empty). */
    String letters() {
        int start = pos;
        while (!atEnd() && isAsciiLetter(peek())) {
            next();
        }
        return text.substring(start, pos);
    }

    /** Consume a run of ASCII letters, digits and underscores (may be empty). */
    String identifier() {
        int start = pos;
        while (!atEnd() && (isAsciiLetter(peek()) || isAsciiDigit(peek()) || peek() == '_')) {
            next();
        }
        return text.substring(start, pos);
    }

    /** Consume a run of ASCII digits (may be empty). */
    String digits() {
        int start = pos;
        while (!atEnd() && isAsciiDigit(peek())) {
            next();
        }
        return text.substring(start, pos);
    }

    /**
     * Consume characters up to (not including) {@code terminator}.
     *
     * @return the consumed text, or null if the terminator never appears
     */
    String until(char terminator) {
        int end = text.indexOf(terminator, pos);
        if (end < 0) {
            return null;
        }
        int start = pos;
        while (pos < end) {
            next();
        }
        return text.substring(start, end);
    }

    Mark mark() {
        return new Mark(pos, line, column);
    }

    void reset(Mark mark) {
        this.pos = mark.pos();
        this.line = mark.line();
        this.column = mark.column();
    }

    int line() {
        return line;
    }

    int column() {
        return column;
    }

    static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
