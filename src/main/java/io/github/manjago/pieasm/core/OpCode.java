package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Machine operations understood by the register machine.
 * <p>
 * Instruction word layout (4 bytes, body of a PIE image):
 * <pre>
 * [byte 0: opcode | byte 1 | byte 2 | byte 3]
 * </pre>
 * Operand bytes follow the opcode in source order: a register takes one byte,
 * an integer or resolved label takes two (high byte first). Unused bytes are zero.
 * <p>
 * The {@link Shape} of an opcode is a rendering hint for the {@link Disassembler};
 * the encoder itself does not enforce it.
 */
public enum OpCode {

    // ========== Data movement ==========

    /** Load. $r = imm16 */
    LOAD(0, "load", Shape.REG_IMM),

    // ========== Arithmetic ==========

    /** Add. $r3 = $r1 + $r2 */
    ADD(1, "add", Shape.REG_REG_REG),

    /** Subtract. $r3 = $r1 - $r2 */
    SUB(2, "sub", Shape.REG_REG_REG),

    /** Multiply. $r3 = $r1 * $r2 */
    MUL(3, "mul", Shape.REG_REG_REG),

    /** Divide. $r3 = $r1 / $r2, remainder kept by the engine */
    DIV(4, "div", Shape.REG_REG_REG),

    /** Halt execution. */
    HLT(5, "hlt", Shape.NONE),

    // ========== Control Flow ==========

    /** Absolute jump. */
    JMP(6, "jmp", Shape.ADDR),

    /** Relative jump forward. */
    JMPF(7, "jmpf", Shape.ADDR),

    /** Relative jump backward. */
    JMPB(8, "jmpb", Shape.ADDR),

    // ========== Comparison (sets the equality flag) ==========

    EQ(9, "eq", Shape.REG_REG),
    NEQ(10, "neq", Shape.REG_REG),
    GTE(11, "gte", Shape.REG_REG),
    LTE(12, "lte", Shape.REG_REG),
    LT(13, "lt", Shape.REG_REG),
    GT(14, "gt", Shape.REG_REG),

    /** Jump if the equality flag is set. */
    JMPE(15, "jmpe", Shape.ADDR),

    /** No Operation. */
    NOP(16, "nop", Shape.NONE),

    /** Grow the heap by $r bytes. */
    ALOC(17, "aloc", Shape.REG),

    /** Increment. $r = $r + 1 */
    INC(18, "inc", Shape.REG),

    /** Decrement. $r = $r - 1 */
    DEC(19, "dec", Shape.REG),

    /**
     * Illegal opcode. Produced for every mnemonic that is not in this table;
     * the engine halts when it executes one.
     */
    IGL(255, "igl", Shape.NONE);

    /**
     * Operand layout used when rendering a decoded word.
     */
    public enum Shape {
        NONE,
        REG,
        REG_REG,
        REG_REG_REG,
        REG_IMM,
        ADDR
    }

    // ========== Fields & Constructor ==========

    private final int code;
    private final String mnemonic;
    private final Shape shape;

    OpCode(int code, String mnemonic, Shape shape) {
        this.code = code;
        this.mnemonic = mnemonic;
        this.shape = shape;
    }

    public int getCode() {
        return code;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    public Shape getShape() {
        return shape;
    }

    // ========== Lookup ==========

    private static final OpCode[] BY_CODE = new OpCode[256];
    private static final Map<String, OpCode> BY_MNEMONIC = new HashMap<>();

    static {
        for (OpCode op : values()) {
            BY_CODE[op.code] = op;
            BY_MNEMONIC.put(op.mnemonic, op);
        }
    }

    /**
     * Get OpCode by its numeric code.
     * @param code numeric opcode (0-255)
     * @return OpCode or null if not found
     */
    @Contract(pure = true)
    public static @Nullable OpCode fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return null;
        }
        return BY_CODE[code];
    }

    /**
     * Get OpCode by mnemonic (case-insensitive).
     * Unknown mnemonics map to {@link #IGL} rather than failing.
     */
    @Contract(pure = true)
    public static @NotNull OpCode fromMnemonic(@NotNull String mnemonic) {
        return BY_MNEMONIC.getOrDefault(mnemonic.toLowerCase(Locale.ROOT), IGL);
    }
}
