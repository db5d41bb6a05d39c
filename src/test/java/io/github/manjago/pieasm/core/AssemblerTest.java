package io.github.manjago.pieasm.core;

import io.github.manjago.pieasm.config.AssemblerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the two-pass Assembler.
 */
class AssemblerTest {

    private static final String WRAPPER = ".data\n.code\n";

    private Assembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new Assembler(AssemblerConfig.builder().build());
    }

    private byte[] body(byte[] image) {
        return Arrays.copyOfRange(image, PieHeader.LENGTH, image.length);
    }

    private AssemblyException assertFails(String source) {
        return assertThrows(AssemblyException.class, () -> assembler.assemble(source));
    }

    @Nested
    @DisplayName("Image layout")
    class Layout {

        @Test
        @DisplayName("Image starts with magic and zero padding")
        void headerInvariant() throws Exception {
            byte[] image = assembler.assemble(WRAPPER + "hlt");

            assertArrayEquals(PieHeader.magic(), Arrays.copyOf(image, 4));
            for (int i = 4; i < PieHeader.LENGTH; i++) {
                assertEquals(0, image[i], "header byte " + i);
            }
            assertEquals(OpCode.HLT.getCode(), image[PieHeader.LENGTH]);
        }

        @Test
        @DisplayName("Body is one 4-byte word per opcode instruction")
        void wordAlignment() throws Exception {
            byte[] image = assembler.assemble(WRAPPER + "inc $1\ndec $2\nnop\nhlt");
            byte[] body = body(image);

            assertEquals(0, body.length % InstructionEncoder.WORD_SIZE);
            assertEquals(4, body.length / InstructionEncoder.WORD_SIZE);
            assertEquals(OpCode.INC.getCode(), body[0]);
            assertEquals(OpCode.DEC.getCode(), body[4]);
            assertEquals(OpCode.NOP.getCode(), body[8]);
            assertEquals(OpCode.HLT.getCode(), body[12]);
        }

        @Test
        @DisplayName("Assembling twice yields identical bytes")
        void deterministic() throws Exception {
            String source = WRAPPER + "start: load $0 #100\ninc $0\njmp @start\nhlt";
            assertArrayEquals(assembler.assemble(source), assembler.assemble(source));
            assertArrayEquals(assembler.assemble(source), new Assembler().assemble(source));
        }

        @Test
        @DisplayName("Directives produce no body bytes")
        void directivesProduceNothing() throws Exception {
            byte[] image = assembler.assemble(".data\nmsg: .asciiz 'Hello'\n.code\nhlt");
            assertEquals(PieHeader.LENGTH + 4, image.length);
        }

        @Test
        @DisplayName("Comments before and after instructions are skipped")
        void comments() throws Exception {
            byte[] image = assembler.assemble("""
                ; program header
                .data        ; constants
                .code
                ; leading comment
                inc $3       ; trailing comment
                hlt
                """);
            byte[] body = body(image);
            assertArrayEquals(new byte[]{18, 3, 0, 0, 5, 0, 0, 0}, body);
        }
    }

    @Nested
    @DisplayName("Label resolution")
    class Labels {

        @Test
        @DisplayName("Backward reference resolves to the label's word address")
        void backwardReference() throws Exception {
            AssemblyOutput out = assembler.assembleDetailed(".data\n.code\nhello: inc $0\njmp @hello\nhlt");

            // .data=0, .code=1, hello=2 -> 2 * 4
            assertEquals(8L, out.symbols().lookup("hello").orElseThrow());
            byte[] body = out.body();
            assertArrayEquals(new byte[]{18, 0, 0, 0}, Arrays.copyOfRange(body, 0, 4));
            assertArrayEquals(new byte[]{6, 0, 8, 0}, Arrays.copyOfRange(body, 4, 8));
            assertArrayEquals(new byte[]{5, 0, 0, 0}, Arrays.copyOfRange(body, 8, 12));
        }

        @Test
        @DisplayName("Forward reference resolves")
        void forwardReference() throws Exception {
            AssemblyOutput out = assembler.assembleDetailed(WRAPPER + "jmp @skip\nnop\nskip: hlt");

            assertEquals(16L, out.symbols().lookup("skip").orElseThrow());
            assertEquals(16, Disassembler.decodeHalfWord(out.body(), 0, 1));
        }

        @Test
        @DisplayName("Label on its own line binds to the next instruction")
        void labelOnOwnLine() throws Exception {
            AssemblyOutput out = assembler.assembleDetailed(WRAPPER + "loop:\n    inc $0\n    jmp @loop");
            assertEquals(8L, out.symbols().lookup("loop").orElseThrow());
        }

        @Test
        @DisplayName("Counting loop: 7 words and jmpe targets test:")
        void countingLoop() throws Exception {
            String source = WRAPPER
                    + "load $0 #100\nload $1 #1\nload $2 #0\ntest: inc $0\nneq $0 $2\njmpe @test\nhlt";

            AssemblyOutput out = assembler.assembleDetailed(source);

            assertEquals(PieHeader.LENGTH + 28, out.image().length);
            assertEquals(7, out.instructionCount());

            long test = out.symbols().lookup("test").orElseThrow();
            assertEquals(20L, test);

            byte[] body = out.body();
            assertArrayEquals(new byte[]{0, 0, 0, 100}, Arrays.copyOfRange(body, 0, 4));
            assertArrayEquals(new byte[]{10, 0, 2, 0}, Arrays.copyOfRange(body, 16, 20));
            assertEquals(OpCode.JMPE, Disassembler.decodeOpCode(body, 20));
            assertEquals(test, Disassembler.decodeHalfWord(body, 20, 1));
        }

        @Test
        @DisplayName("Unresolved label fails by default")
        void unresolvedFails() {
            AssemblyException e = assertFails(WRAPPER + "jmp @nowhere");
            assertTrue(e.hasKind(AssemblerError.Kind.UNRESOLVED_LABEL));
            assertEquals(2, e.getErrors().get(0).instruction());
        }

        @Test
        @DisplayName("Unresolved label is zero-filled when configured to warn")
        void unresolvedWarns() throws Exception {
            Assembler lenient = new Assembler(AssemblerConfig.builder()
                    .unresolvedLabels(AssemblerConfig.LabelPolicy.WARN)
                    .build());

            byte[] image = lenient.assemble(WRAPPER + "jmp @nowhere\nhlt");
            assertArrayEquals(new byte[]{6, 0, 0, 0, 5, 0, 0, 0}, body(image));
        }

        @Test
        @DisplayName("Offsets above 0xFFFF keep their low 16 bits by default")
        void offsetTruncated() throws Exception {
            String source = ".data\nbig: .asciiz '" + "x".repeat(70_000) + "'\nfar: .asciiz 'y'\n.code\njmp @far";

            AssemblyOutput out = assembler.assembleDetailed(source);

            assertEquals(70_001L, out.symbols().lookup("far").orElseThrow());
            assertEquals(70_001 & 0xFFFF, Disassembler.decodeHalfWord(out.body(), 0, 1));
        }

        @Test
        @DisplayName("Offsets above 0xFFFF are rejected when configured")
        void offsetRejected() {
            Assembler strict = new Assembler(AssemblerConfig.builder()
                    .offsetOverflow(AssemblerConfig.OffsetPolicy.REJECT)
                    .build());
            String source = ".data\nbig: .asciiz '" + "x".repeat(70_000) + "'\nfar: .asciiz 'y'\n.code\njmp @far";

            AssemblyException e = assertThrows(AssemblyException.class, () -> strict.assemble(source));
            assertTrue(e.hasKind(AssemblerError.Kind.OFFSET_OUT_OF_RANGE));
        }
    }

    @Nested
    @DisplayName("String constants")
    class Strings {

        @Test
        @DisplayName(".asciiz places bytes and NUL in the read-only segment")
        void stringPlacement() throws Exception {
            AssemblyOutput out = assembler.assembleDetailed(".data\nmsg: .asciiz 'Hi'\n.code\nhlt");

            assertEquals(0L, out.symbols().lookup("msg").orElseThrow());
            assertArrayEquals(new byte[]{'H', 'i', 0}, out.readOnlyData());
        }

        @Test
        @DisplayName("Consecutive strings are laid out back to back")
        void consecutiveStrings() throws Exception {
            AssemblyOutput out = assembler.assembleDetailed(
                    ".data\na: .asciiz 'Hi'\nb: .asciiz 'Yo!'\n.code\nload $0 @b\nhlt");

            assertEquals(0L, out.symbols().lookup("a").orElseThrow());
            assertEquals(3L, out.symbols().lookup("b").orElseThrow());
            assertArrayEquals(new byte[]{'H', 'i', 0, 'Y', 'o', '!', 0}, out.readOnlyData());
            assertArrayEquals(new byte[]{0, 0, 0, 3}, Arrays.copyOfRange(out.body(), 0, 4));
        }

        @Test
        @DisplayName("Empty string is a lone NUL")
        void emptyString() throws Exception {
            AssemblyOutput out = assembler.assembleDetailed(".data\ne: .asciiz ''\n.code\nhlt");
            assertArrayEquals(new byte[]{0}, out.readOnlyData());
        }

        @Test
        @DisplayName(".asciiz without a label is an error")
        void withoutLabel() {
            AssemblyException e = assertFails(".data\n.asciiz 'Hi'\n.code\nhlt");

            AssemblerError error = e.getErrors().get(0);
            assertEquals(AssemblerError.Kind.STRING_CONSTANT_WITHOUT_LABEL, error.kind());
            assertEquals(1, error.instruction());
            assertEquals(2, error.line());
        }

        @Test
        @DisplayName(".asciiz without a string is an error")
        void withoutValue() {
            AssemblyException e = assertFails(".data\nmsg: .asciiz\n.code\nhlt");
            assertTrue(e.hasKind(AssemblerError.Kind.STRING_CONSTANT_WITHOUT_VALUE));
        }
    }

    @Nested
    @DisplayName("First pass diagnostics")
    class FirstPass {

        @Test
        @DisplayName("Duplicate label is rejected")
        void duplicateSymbol() {
            AssemblyException e = assertFails(WRAPPER + "x: inc $0\nx: dec $0\nhlt");

            assertEquals(1, e.getErrors().size());
            assertEquals(AssemblerError.Kind.SYMBOL_ALREADY_DECLARED, e.getErrors().get(0).kind());
        }

        @Test
        @DisplayName("Label before any section is rejected")
        void noSegment() {
            AssemblyException e = assertFails("x: hlt\n.data\n.code");

            AssemblerError error = e.getErrors().get(0);
            assertEquals(AssemblerError.Kind.NO_SEGMENT_DECLARATION, error.kind());
            assertEquals(0, error.instruction());
        }

        @Test
        @DisplayName("All first pass errors are reported together")
        void batchDiagnostics() {
            AssemblyException e = assertFails("x: hlt\n.data\n.asciiz 'a'\n.code\ny: hlt\ny: hlt");

            List<AssemblerError.Kind> kinds = e.getErrors().stream().map(AssemblerError::kind).toList();
            assertEquals(List.of(
                    AssemblerError.Kind.NO_SEGMENT_DECLARATION,
                    AssemblerError.Kind.STRING_CONSTANT_WITHOUT_LABEL,
                    AssemblerError.Kind.SYMBOL_ALREADY_DECLARED), kinds);
        }

        @Test
        @DisplayName("First pass errors take priority over the section check")
        void errorsBeforeSectionCheck() {
            AssemblyException e = assertFails("x: hlt");
            assertTrue(e.hasKind(AssemblerError.Kind.NO_SEGMENT_DECLARATION));
            assertFalse(e.hasKind(AssemblerError.Kind.INSUFFICIENT_SECTIONS));
        }
    }

    @Nested
    @DisplayName("Section count")
    class Sections {

        @ParameterizedTest
        @ValueSource(strings = {
            "hlt",
            ".code\nhlt",
            ".data\nhlt",
            ".data\n.code\n.data\nhlt",
            ".data\n.code\n.code\n.data\nhlt"
        })
        @DisplayName("Anything but two sections fails")
        void wrongSectionCount(String source) {
            AssemblyException e = assertFails(source);
            assertEquals(List.of(AssemblerError.Kind.INSUFFICIENT_SECTIONS),
                    e.getErrors().stream().map(AssemblerError::kind).toList());
        }

        @Test
        @DisplayName("One .data and one .code succeed")
        void twoSections() throws Exception {
            AssemblyOutput out = assembler.assembleDetailed(WRAPPER + "hlt");
            assertEquals(List.of(Section.Kind.DATA, Section.Kind.CODE),
                    out.sections().stream().map(Section::kind).toList());
        }

        @Test
        @DisplayName("Only the total count is checked, not the kinds")
        void countNotKinds() throws Exception {
            byte[] image = assembler.assemble(".code\n.code\nhlt");
            assertEquals(PieHeader.LENGTH + 4, image.length);
        }

        @Test
        @DisplayName("Unknown section directive is ignored")
        void unknownSectionIgnored() throws Exception {
            AssemblyOutput out = assembler.assembleDetailed(".data\n.text\n.code\nhlt");
            assertEquals(2, out.sections().size());
        }
    }

    @Nested
    @DisplayName("Operand encoding errors")
    class Operands {

        @Test
        @DisplayName("Parse failure is reported as a single error")
        void parseError() {
            AssemblyException e = assertFails(WRAPPER + "load $0 #");

            assertEquals(1, e.getErrors().size());
            AssemblerError error = e.getErrors().get(0);
            assertEquals(AssemblerError.Kind.PARSE_ERROR, error.kind());
            assertEquals(3, error.line());
        }

        @Test
        @DisplayName("Empty source is a parse failure")
        void emptySource() {
            assertTrue(assertFails("").hasKind(AssemblerError.Kind.PARSE_ERROR));
        }

        @Test
        @DisplayName("Integer beyond 16 bits is rejected")
        void integerOutOfRange() {
            AssemblyException e = assertFails(WRAPPER + "load $0 #70000");
            assertTrue(e.hasKind(AssemblerError.Kind.INTEGER_OUT_OF_RANGE));
        }

        @Test
        @DisplayName("Too many operand bytes overflow the word")
        void wordOverflow() {
            AssemblyException e = assertFails(WRAPPER + "load #1 #2");
            assertTrue(e.hasKind(AssemblerError.Kind.WORD_OVERFLOW));
        }

        @Test
        @DisplayName("String operand on an opcode is rejected")
        void stringOnOpcode() {
            AssemblyException e = assertFails(WRAPPER + "load $0 'x'");
            assertTrue(e.hasKind(AssemblerError.Kind.INVALID_OPERAND));
        }

        @Test
        @DisplayName("Second pass errors are collected across instructions")
        void secondPassBatch() {
            AssemblyException e = assertFails(WRAPPER + "jmp @a\nload $0 #99999\njmp @b");
            assertEquals(3, e.getErrors().size());
        }

        @Test
        @DisplayName("Unknown mnemonic encodes as IGL")
        void illegalOpcode() throws Exception {
            byte[] image = assembler.assemble(WRAPPER + "frobnicate $1");
            assertArrayEquals(new byte[]{(byte) 0xFF, 1, 0, 0}, body(image));
        }
    }

    @Nested
    @DisplayName("Snippet mode")
    class Snippets {

        @Test
        @DisplayName("Snippet has no header and needs no sections")
        void snippet() throws Exception {
            assertArrayEquals(new byte[]{0, 0, 0, 100}, assembler.assembleSnippet("load $0 #100"));
        }

        @Test
        @DisplayName("Snippet cannot resolve labels")
        void snippetLabel() {
            AssemblyException e = assertThrows(AssemblyException.class,
                    () -> assembler.assembleSnippet("jmp @somewhere"));
            assertTrue(e.hasKind(AssemblerError.Kind.UNRESOLVED_LABEL));
        }
    }
}
