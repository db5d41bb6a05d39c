package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Program region opened by a section directive.
 *
 * @param kind             region kind
 * @param startInstruction index of the directive that opened it
 */
public record Section(@NotNull Kind kind, int startInstruction) {

    public enum Kind {
        /** {@code .data}: read-only constants. */
        DATA,
        /** {@code .code}: executable instructions. */
        CODE,
        UNKNOWN
    }

    /**
     * Map a directive name to a section kind. Anything other than
     * {@code data} or {@code code} is {@link Kind#UNKNOWN}.
     */
    public static Kind kindOf(@NotNull String directiveName) {
        return switch (directiveName.toLowerCase(Locale.ROOT)) {
            case "data" -> Kind.DATA;
            case "code" -> Kind.CODE;
            default -> Kind.UNKNOWN;
        };
    }

    public static boolean isSectionDirective(@NotNull String directiveName) {
        return kindOf(directiveName) != Kind.UNKNOWN;
    }
}
