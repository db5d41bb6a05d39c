package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.NotNull;

/**
 * Named address known to the assembler.
 *
 * @param name   unique key in the {@link SymbolTable}
 * @param type   symbol kind
 * @param offset unsigned 32-bit offset, held in a long
 */
public record Symbol(@NotNull String name, @NotNull Type type, long offset) {

    public static final long MAX_OFFSET = 0xFFFF_FFFFL;

    public enum Type {
        LABEL
    }

    public Symbol {
        if (offset < 0 || offset > MAX_OFFSET) {
            throw new IllegalArgumentException("Offset out of unsigned 32-bit range: " + offset);
        }
    }

    public static Symbol label(@NotNull String name, long offset) {
        return new Symbol(name, Type.LABEL, offset);
    }

    public Symbol withOffset(long newOffset) {
        return new Symbol(name, type, newOffset);
    }
}
