package io.github.manjago.pieasm.core;

import io.github.manjago.pieasm.config.AssemblerConfig;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;

/**
 * Serializes opcode instructions into 4-byte words.
 * <pre>
 * byte 0      opcode
 * bytes 1..3  operands in source order, zero padded
 *             register  -> 1 byte (index)
 *             integer   -> 2 bytes, high byte first
 *             @label    -> 2 bytes, low 16 bits of the offset, high byte first
 * </pre>
 * Label offsets are 32-bit but only 16 bits fit in a word; with
 * {@link AssemblerConfig.OffsetPolicy#TRUNCATE} anything above 0xFFFF loses its high half.
 */
public class InstructionEncoder {

    private static final Logger log = LoggerFactory.getLogger(InstructionEncoder.class);

    public static final int WORD_SIZE = 4;

    /** Smallest and largest literal that fits in 16 bits, signed or unsigned. */
    public static final int MIN_INTEGER = Short.MIN_VALUE;
    public static final int MAX_INTEGER = 0xFFFF;

    private final SymbolTable symbols;
    private final AssemblerConfig config;

    public InstructionEncoder(@NotNull SymbolTable symbols, @NotNull AssemblerConfig config) {
        this.symbols = symbols;
        this.config = config;
    }

    /**
     * Encode one opcode instruction.
     *
     * @param instruction instruction with an opcode
     * @param index       position in the program, for diagnostics
     * @return exactly {@value #WORD_SIZE} bytes
     * @throws EncodingException if an operand cannot be encoded
     */
    public byte[] encode(@NotNull Instruction instruction, int index) throws EncodingException {
        Token.Op op = instruction.opcode();
        if (op == null) {
            throw new EncodingException(AssemblerError.at(AssemblerError.Kind.INVALID_OPERAND,
                    "Directive cannot be encoded as an instruction word", index, instruction.line()));
        }

        WordWriter word = new WordWriter(instruction, index);
        word.put(op.code().getCode());

        for (Token operand : instruction.operands()) {
            if (operand instanceof Token.Register r) {
                word.put(r.index());
            } else if (operand instanceof Token.IntegerOperand n) {
                writeInteger(word, n.value(), instruction, index);
            } else if (operand instanceof Token.LabelUsage l) {
                writeLabel(word, l.name(), instruction, index);
            } else {
                throw new EncodingException(AssemblerError.at(AssemblerError.Kind.INVALID_OPERAND,
                        "Unexpected token in operand field: " + operand, index, instruction.line()));
            }
        }

        return word.toBytes();
    }

    private void writeInteger(WordWriter word, int value, Instruction instruction, int index)
            throws EncodingException {
        if (value < MIN_INTEGER || value > MAX_INTEGER) {
            throw new EncodingException(AssemblerError.at(AssemblerError.Kind.INTEGER_OUT_OF_RANGE,
                    "Integer out of 16-bit range: " + value + " (expected " + MIN_INTEGER + ".." + MAX_INTEGER + ")",
                    index, instruction.line()));
        }
        word.putHalfWord(value);
    }

    private void writeLabel(WordWriter word, String name, Instruction instruction, int index)
            throws EncodingException {
        OptionalLong offset = symbols.lookup(name);
        if (offset.isEmpty()) {
            log.error("No value found for label '{}' (instruction {}, line {})", name, index, instruction.line());
            if (config.unresolvedLabels() == AssemblerConfig.LabelPolicy.FAIL) {
                throw new EncodingException(AssemblerError.at(AssemblerError.Kind.UNRESOLVED_LABEL,
                        "Undefined label: " + name, index, instruction.line()));
            }
            word.putHalfWord(0);
            return;
        }

        long value = offset.getAsLong();
        if (value > 0xFFFF) {
            if (config.offsetOverflow() == AssemblerConfig.OffsetPolicy.REJECT) {
                throw new EncodingException(AssemblerError.at(AssemblerError.Kind.OFFSET_OUT_OF_RANGE,
                        "Offset of label '" + name + "' does not fit in 16 bits: " + value,
                        index, instruction.line()));
            }
            log.warn("Offset of label '{}' truncated to 16 bits: {} -> {}", name, value, value & 0xFFFF);
        }
        word.putHalfWord((int) (value & 0xFFFF));
    }

    /**
     * Fixed-size word buffer that refuses to grow past {@value #WORD_SIZE} bytes.
     */
    private static final class WordWriter {
        private final byte[] bytes = new byte[WORD_SIZE];
        private final Instruction instruction;
        private final int index;
        private int position;

        WordWriter(Instruction instruction, int index) {
            this.instruction = instruction;
            this.index = index;
        }

        void put(int value) throws EncodingException {
            if (position >= WORD_SIZE) {
                throw new EncodingException(AssemblerError.at(AssemblerError.Kind.WORD_OVERFLOW,
                        "Operands do not fit in a " + WORD_SIZE + "-byte word", index, instruction.line()));
            }
            bytes[position++] = (byte) value;
        }

        void putHalfWord(int value) throws EncodingException {
            put(value >> 8);
            put(value);
        }

        byte[] toBytes() {
            return bytes;
        }
    }
}
