package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;

/**
 * Everything a successful run produced.
 *
 * @param image        header followed by the instruction body
 * @param readOnlyData read-only segment built from string constants
 * @param symbols      final symbol table
 * @param sections     sections in the order they were opened
 */
public record AssemblyOutput(
        byte @NotNull [] image,
        byte @NotNull [] readOnlyData,
        @NotNull SymbolTable symbols,
        @NotNull List<Section> sections
) {

    public AssemblyOutput {
        sections = List.copyOf(sections);
    }

    public byte[] body() {
        return Arrays.copyOfRange(image, PieHeader.LENGTH, image.length);
    }

    public int instructionCount() {
        return (image.length - PieHeader.LENGTH) / InstructionEncoder.WORD_SIZE;
    }
}
