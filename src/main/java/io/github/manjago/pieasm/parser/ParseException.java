package io.github.manjago.pieasm.parser;

/**
 * Source text could not be parsed into a program.
 */
public class ParseException extends Exception {

    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super("Line " + line + ", column " + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public ParseException(String message, int line, int column, Throwable cause) {
        super("Line " + line + ", column " + column + ": " + message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
