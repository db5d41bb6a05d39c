package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.NotNull;

/**
 * Lexical unit of the assembly language.
 * <p>
 * The set of token kinds is closed; equality is structural (records).
 */
public sealed interface Token {

    /** Operation code, e.g. {@code load}. Unknown words carry {@link OpCode#IGL}. */
    record Op(@NotNull OpCode code) implements Token {}

    /** Register operand, e.g. {@code $3}. */
    record Register(int index) implements Token {
        public Register {
            if (index < 0 || index > 0xFF) {
                throw new IllegalArgumentException("Register index out of byte range: " + index);
            }
        }
    }

    /** Integer operand, e.g. {@code #100}. Range is checked when encoding. */
    record IntegerOperand(int value) implements Token {}

    /** Label declaration, e.g. {@code loop:} (name without the colon). */
    record LabelDeclaration(@NotNull String name) implements Token {}

    /** Label reference, e.g. {@code @loop} (name without the at sign). */
    record LabelUsage(@NotNull String name) implements Token {}

    /** Directive, e.g. {@code .asciiz} (name without the dot). */
    record Directive(@NotNull String name) implements Token {}

    /** Single-quoted string literal, content taken verbatim. */
    record StringLiteral(@NotNull String value) implements Token {}
}
