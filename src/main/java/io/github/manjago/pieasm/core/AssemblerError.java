package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.NotNull;

/**
 * One structured diagnostic produced by the assembler.
 *
 * @param kind        error category
 * @param message     human-readable description
 * @param instruction index of the offending instruction, -1 if not tied to one
 * @param line        1-based source line, -1 if unknown
 */
public record AssemblerError(@NotNull Kind kind, @NotNull String message, int instruction, int line) {

    public enum Kind {
        PARSE_ERROR,
        NO_SEGMENT_DECLARATION,
        STRING_CONSTANT_WITHOUT_LABEL,
        STRING_CONSTANT_WITHOUT_VALUE,
        SYMBOL_ALREADY_DECLARED,
        INSUFFICIENT_SECTIONS,
        UNRESOLVED_LABEL,
        INVALID_OPERAND,
        INTEGER_OUT_OF_RANGE,
        OFFSET_OUT_OF_RANGE,
        WORD_OVERFLOW
    }

    public static AssemblerError global(@NotNull Kind kind, @NotNull String message) {
        return new AssemblerError(kind, message, -1, -1);
    }

    public static AssemblerError at(@NotNull Kind kind, @NotNull String message, int instruction, int line) {
        return new AssemblerError(kind, message, instruction, line);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (line > 0) {
            sb.append("Line ").append(line).append(": ");
        }
        sb.append(message);
        if (instruction >= 0) {
            sb.append(" (instruction ").append(instruction).append(')');
        }
        sb.append(" [").append(kind).append(']');
        return sb.toString();
    }
}
