package io.github.manjago.pieasm.core;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of a single assembly run. Created fresh by {@link Assembler}
 * for every call and never shared.
 */
final class AssemblerState {

    enum Phase {
        FIRST,
        SECOND
    }

    Phase phase = Phase.FIRST;
    final SymbolTable symbols = new SymbolTable();

    /** Read-only data segment filled by {@code .asciiz}. */
    final ByteArrayOutputStream readOnly = new ByteArrayOutputStream();
    long readOnlyOffset;

    final ByteArrayOutputStream bytecode = new ByteArrayOutputStream();

    final List<Section> sections = new ArrayList<>();
    Section currentSection;

    int currentInstruction;

    /** Address cursor, advanced one word per instruction. */
    long address;

    final List<AssemblerError> errors = new ArrayList<>();

    void error(AssemblerError error) {
        errors.add(error);
    }

    boolean hasErrors() {
        return !errors.isEmpty();
    }
}
