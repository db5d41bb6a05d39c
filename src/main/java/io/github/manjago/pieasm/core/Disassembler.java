package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Disassembler for PIE instruction words.
 * <p>
 * Decodes the layout written by {@link InstructionEncoder}. Operand rendering follows
 * each opcode's {@link OpCode.Shape}; label names are gone after assembly, so addresses
 * print as integers.
 */
public final class Disassembler {

    private Disassembler() {
        // Utility class
    }

    // ========== Word decoding ==========

    /**
     * Decode the opcode of the word starting at {@code offset}.
     *
     * @return OpCode or null if the byte is not a known opcode
     */
    public static @Nullable OpCode decodeOpCode(byte @NotNull [] body, int offset) {
        return OpCode.fromCode(body[offset] & 0xFF);
    }

    /**
     * Decode a one-byte register operand.
     *
     * @param slot operand byte position within the word (1-3)
     */
    public static int decodeRegister(byte @NotNull [] body, int offset, int slot) {
        return body[offset + slot] & 0xFF;
    }

    /**
     * Decode a two-byte operand (integer or address), high byte first.
     *
     * @param slot position of the high byte within the word (1 or 2)
     * @return unsigned 16-bit value
     */
    public static int decodeHalfWord(byte @NotNull [] body, int offset, int slot) {
        return ((body[offset + slot] & 0xFF) << 8) | (body[offset + slot + 1] & 0xFF);
    }

    // ========== Listings ==========

    /**
     * Disassemble the word starting at {@code offset}.
     *
     * @return assembly string like "load $0 #100" or "hlt"
     */
    public static @NotNull String disassemble(byte @NotNull [] body, int offset) {
        final OpCode op = decodeOpCode(body, offset);

        if (op == null) {
            return String.format("??? 0x%02X", body[offset] & 0xFF);
        }

        final String m = op.getMnemonic();

        return switch (op.getShape()) {
            case NONE -> m;
            case REG -> String.format("%s $%d", m, decodeRegister(body, offset, 1));
            case REG_REG -> String.format("%s $%d $%d", m,
                    decodeRegister(body, offset, 1), decodeRegister(body, offset, 2));
            case REG_REG_REG -> String.format("%s $%d $%d $%d", m,
                    decodeRegister(body, offset, 1), decodeRegister(body, offset, 2),
                    decodeRegister(body, offset, 3));
            case REG_IMM -> String.format("%s $%d #%d", m,
                    decodeRegister(body, offset, 1), decodeHalfWord(body, offset, 2));
            case ADDR -> String.format("%s #%d", m, decodeHalfWord(body, offset, 1));
        };
    }

    /**
     * Disassemble an instruction body with byte addresses and a hex dump.
     *
     * @param body concatenated 4-byte words, without header
     * @return multi-line assembly listing
     */
    public static @NotNull String disassemble(byte @NotNull [] body) {
        if (body.length % InstructionEncoder.WORD_SIZE != 0) {
            throw new IllegalArgumentException("Body length " + body.length + " is not a multiple of "
                    + InstructionEncoder.WORD_SIZE);
        }

        StringBuilder sb = new StringBuilder();
        for (int offset = 0; offset < body.length; offset += InstructionEncoder.WORD_SIZE) {
            if (offset > 0) {
                sb.append('\n');
            }
            sb.append(String.format("%04X: %02X %02X %02X %02X  %s",
                    offset,
                    body[offset] & 0xFF, body[offset + 1] & 0xFF,
                    body[offset + 2] & 0xFF, body[offset + 3] & 0xFF,
                    disassemble(body, offset)));
        }
        return sb.toString();
    }

    /**
     * Disassemble a complete PIE image (header is checked and skipped).
     */
    public static @NotNull String disassembleImage(byte @NotNull [] image) {
        return disassemble(PieHeader.body(image));
    }
}
