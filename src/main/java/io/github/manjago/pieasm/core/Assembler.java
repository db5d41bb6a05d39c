package io.github.manjago.pieasm.core;

import io.github.manjago.pieasm.config.AssemblerConfig;
import io.github.manjago.pieasm.parser.ParseException;
import io.github.manjago.pieasm.parser.SourceParser;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Two-pass assembler producing PIE images.
 *
 * <h2>Syntax:</h2>
 * <pre>
 * ; Comment (from ; to end of line)
 * .data                     ; read-only data section
 * greeting: .asciiz 'Hi'    ; NUL-terminated string constant
 * .code                     ; executable section
 * start: load $0 #100       ; label, opcode, register, integer
 *        jmpe @start        ; label reference
 *        hlt
 * </pre>
 *
 * <h2>Passes:</h2>
 * <ol>
 *   <li>Walk every instruction, register labels at their word address and lay out
 *       {@code .asciiz} constants in the read-only segment. Errors are collected, not thrown
 *       one by one.</li>
 *   <li>Encode every opcode instruction into one 4-byte word using the now complete
 *       symbol table.</li>
 * </ol>
 * A run either returns a complete image or throws {@link AssemblyException} with all
 * diagnostics; partial output is never returned. Instances hold no per-run state and
 * may be reused.
 */
public class Assembler {

    private static final Logger log = LoggerFactory.getLogger(Assembler.class);

    private static final String STRING_DIRECTIVE = "asciiz";
    private static final int REQUIRED_SECTIONS = 2;

    private final AssemblerConfig config;

    public Assembler() {
        this(AssemblerConfig.defaults());
    }

    public Assembler(@NotNull AssemblerConfig config) {
        this.config = config;
    }

    public AssemblerConfig getConfig() {
        return config;
    }

    /**
     * Assemble source code from string.
     *
     * @param source assembly source code
     * @return PIE image: header followed by instruction words
     * @throws AssemblyException with every collected diagnostic
     */
    public byte[] assemble(@NotNull String source) throws AssemblyException {
        return assembleDetailed(source).image();
    }

    /**
     * Assemble source code from a UTF-8 file.
     *
     * @throws IOException if the file cannot be read
     * @throws AssemblyException with every collected diagnostic
     */
    public byte[] assembleFile(@NotNull Path path) throws IOException, AssemblyException {
        return assemble(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Assemble source code, keeping the read-only segment and symbol table.
     */
    public AssemblyOutput assembleDetailed(@NotNull String source) throws AssemblyException {
        return assemble(parse(source));
    }

    /**
     * Run both passes over an already parsed program.
     */
    public AssemblyOutput assemble(@NotNull Program program) throws AssemblyException {
        AssemblerState state = new AssemblerState();

        processFirstPhase(program, state);

        if (state.hasErrors()) {
            log.warn("First pass found {} error(s), skipping code generation", state.errors.size());
            throw new AssemblyException(state.errors);
        }

        if (state.sections.size() != REQUIRED_SECTIONS) {
            log.warn("Expected {} sections, found {}", REQUIRED_SECTIONS, state.sections.size());
            state.error(AssemblerError.global(AssemblerError.Kind.INSUFFICIENT_SECTIONS,
                    "Program must declare exactly one .data and one .code section, found "
                            + state.sections.size() + " section(s)"));
            throw new AssemblyException(state.errors);
        }

        processSecondPhase(program, state);

        if (state.hasErrors()) {
            log.warn("Second pass found {} error(s)", state.errors.size());
            throw new AssemblyException(state.errors);
        }

        byte[] header = PieHeader.write();
        byte[] body = state.bytecode.toByteArray();
        byte[] image = new byte[header.length + body.length];
        System.arraycopy(header, 0, image, 0, header.length);
        System.arraycopy(body, 0, image, header.length, body.length);

        log.info("Assembled {} words ({} bytes, {} read-only) from {} instructions",
                body.length / InstructionEncoder.WORD_SIZE, image.length,
                state.readOnly.size(), program.size());

        return new AssemblyOutput(image, state.readOnly.toByteArray(), state.symbols, state.sections);
    }

    /**
     * Encode instructions without header, sections or label support.
     * Used for interactive one-line input.
     *
     * @return concatenated instruction words
     */
    public byte[] assembleSnippet(@NotNull String source) throws AssemblyException {
        Program program = parse(source);
        try {
            return program.toBytes(new InstructionEncoder(new SymbolTable(), config));
        } catch (EncodingException e) {
            throw new AssemblyException(e.getError(), e);
        }
    }

    private Program parse(String source) throws AssemblyException {
        try {
            return SourceParser.parseProgram(source);
        } catch (ParseException e) {
            log.warn("There was an error parsing the code: {}", e.getMessage());
            throw new AssemblyException(
                    AssemblerError.at(AssemblerError.Kind.PARSE_ERROR, e.getMessage(), -1, e.getLine()), e);
        }
    }

    // ========== Pass 1 ==========

    private void processFirstPhase(Program program, AssemblerState state) {
        for (Instruction instruction : program.instructions()) {
            boolean labelRegistered = false;

            if (instruction.hasLabel()) {
                if (state.currentSection != null) {
                    labelRegistered = processLabelDeclaration(instruction, state);
                } else {
                    state.error(AssemblerError.at(AssemblerError.Kind.NO_SEGMENT_DECLARATION,
                            "Label '" + instruction.label().name() + "' declared before any section",
                            state.currentInstruction, instruction.line()));
                }
            }

            if (instruction.isDirective()) {
                processDirective(instruction, labelRegistered, state);
            }

            state.currentInstruction++;
            state.address += InstructionEncoder.WORD_SIZE;
        }

        state.phase = AssemblerState.Phase.SECOND;
    }

    /**
     * @return true if the label was added to the symbol table
     */
    private boolean processLabelDeclaration(Instruction instruction, AssemblerState state) {
        String name = instruction.label().name();

        if (state.symbols.has(name)) {
            state.error(AssemblerError.at(AssemblerError.Kind.SYMBOL_ALREADY_DECLARED,
                    "Symbol already declared: " + name, state.currentInstruction, instruction.line()));
            return false;
        }

        state.symbols.add(Symbol.label(name, state.address));
        log.debug("Label '{}' at address {}", name, state.address);
        return true;
    }

    private void processDirective(Instruction instruction, boolean labelRegistered, AssemblerState state) {
        String name = instruction.directive().name();

        if (Section.isSectionDirective(name)) {
            processSectionHeader(name, state);
        } else if (STRING_DIRECTIVE.equalsIgnoreCase(name)) {
            if (state.phase == AssemblerState.Phase.FIRST) {
                handleAsciiz(instruction, labelRegistered, state);
            }
        } else if (state.phase == AssemblerState.Phase.FIRST) {
            log.info("Ignoring unknown directive .{} at line {}", name, instruction.line());
        }
    }

    /**
     * The first pass records every section; the second only tracks the current one.
     */
    private void processSectionHeader(String name, AssemblerState state) {
        Section section = new Section(Section.kindOf(name), state.currentInstruction);
        if (state.phase == AssemblerState.Phase.FIRST) {
            state.sections.add(section);
            log.debug("Entering {} section at instruction {}", section.kind(), state.currentInstruction);
        }
        state.currentSection = section;
    }

    /**
     * Lay out a NUL-terminated string in the read-only segment and point its label at the first byte.
     */
    private void handleAsciiz(Instruction instruction, boolean labelRegistered, AssemblerState state) {
        if (!instruction.hasLabel()) {
            state.error(AssemblerError.at(AssemblerError.Kind.STRING_CONSTANT_WITHOUT_LABEL,
                    "String constant declared without a label", state.currentInstruction, instruction.line()));
            return;
        }

        String value = instruction.stringConstant().orElse(null);
        if (value == null) {
            state.error(AssemblerError.at(AssemblerError.Kind.STRING_CONSTANT_WITHOUT_VALUE,
                    ".asciiz needs a quoted string operand", state.currentInstruction, instruction.line()));
            return;
        }

        String name = instruction.label().name();
        if (labelRegistered) {
            state.symbols.setOffset(name, state.readOnlyOffset);
        }

        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        state.readOnly.writeBytes(bytes);
        state.readOnly.write(0);
        state.readOnlyOffset += bytes.length + 1L;

        log.debug("String constant '{}' ({} bytes) placed in read-only segment", name, bytes.length + 1);
    }

    // ========== Pass 2 ==========

    private void processSecondPhase(Program program, AssemblerState state) {
        state.currentInstruction = 0;
        state.address = 0;
        state.currentSection = null;

        InstructionEncoder encoder = new InstructionEncoder(state.symbols, config);

        for (Instruction instruction : program.instructions()) {
            if (instruction.isOpcode()) {
                try {
                    state.bytecode.writeBytes(encoder.encode(instruction, state.currentInstruction));
                } catch (EncodingException e) {
                    state.error(e.getError());
                }
            } else if (instruction.isDirective()) {
                processDirective(instruction, false, state);
            }

            state.currentInstruction++;
            state.address += InstructionEncoder.WORD_SIZE;
        }
    }
}
