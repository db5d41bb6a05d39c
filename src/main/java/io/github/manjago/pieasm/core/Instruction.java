package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * One logical source instruction:
 * <pre>
 * [label:] (opcode | .directive) [operand [operand [operand]]]
 * </pre>
 * Exactly one of {@code opcode} and {@code directive} is present.
 *
 * @param label     optional leading label declaration
 * @param opcode    operation, or null for a directive
 * @param directive directive, or null for an operation
 * @param operands  up to three operand tokens in source order
 * @param line      1-based source line the instruction starts on
 */
public record Instruction(
        Token.@Nullable LabelDeclaration label,
        Token.@Nullable Op opcode,
        Token.@Nullable Directive directive,
        @NotNull List<Token> operands,
        int line
) {

    public static final int MAX_OPERANDS = 3;

    public Instruction {
        if ((opcode == null) == (directive == null)) {
            throw new IllegalArgumentException("Instruction needs exactly one of opcode or directive");
        }
        if (operands.size() > MAX_OPERANDS) {
            throw new IllegalArgumentException("Too many operands: " + operands.size());
        }
        operands = List.copyOf(operands);
    }

    public static Instruction op(@Nullable String label, @NotNull OpCode code, Token... operands) {
        return new Instruction(
                label == null ? null : new Token.LabelDeclaration(label),
                new Token.Op(code), null, List.of(operands), 1);
    }

    public static Instruction directive(@Nullable String label, @NotNull String name, Token... operands) {
        return new Instruction(
                label == null ? null : new Token.LabelDeclaration(label),
                null, new Token.Directive(name), List.of(operands), 1);
    }

    public boolean hasLabel() {
        return label != null;
    }

    public boolean isOpcode() {
        return opcode != null;
    }

    public boolean isDirective() {
        return directive != null;
    }

    public Optional<String> labelName() {
        return label == null ? Optional.empty() : Optional.of(label.name());
    }

    public Optional<String> directiveName() {
        return directive == null ? Optional.empty() : Optional.of(directive.name());
    }

    /**
     * First string literal among the operands, if any.
     */
    public Optional<String> stringConstant() {
        for (Token t : operands) {
            if (t instanceof Token.StringLiteral s) {
                return Optional.of(s.value());
            }
        }
        return Optional.empty();
    }
}
