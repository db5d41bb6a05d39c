package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * Parsed program: instructions in source order.
 */
public record Program(@NotNull List<Instruction> instructions) {

    public Program {
        instructions = List.copyOf(instructions);
    }

    public int size() {
        return instructions.size();
    }

    /**
     * Flatten to bytes by encoding every opcode instruction in order.
     * Directives contribute nothing. No section or symbol checks happen here.
     *
     * @throws EncodingException on the first instruction that cannot be encoded
     */
    public byte[] toBytes(@NotNull InstructionEncoder encoder) throws EncodingException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(instructions.size() * InstructionEncoder.WORD_SIZE);
        for (int i = 0; i < instructions.size(); i++) {
            Instruction instruction = instructions.get(i);
            if (instruction.isOpcode()) {
                out.writeBytes(encoder.encode(instruction, i));
            }
        }
        return out.toByteArray();
    }
}
