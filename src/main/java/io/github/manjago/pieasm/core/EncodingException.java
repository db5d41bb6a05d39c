package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.NotNull;

/**
 * An instruction could not be turned into a word.
 */
public class EncodingException extends Exception {

    private final AssemblerError error;

    public EncodingException(@NotNull AssemblerError error) {
        super(error.toString());
        this.error = error;
    }

    public AssemblerError getError() {
        return error;
    }
}
