package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Assembly failed. Carries every diagnostic collected during the run;
 * no partial output accompanies it.
 */
public class AssemblyException extends Exception {

    private final List<AssemblerError> errors;

    public AssemblyException(@NotNull List<AssemblerError> errors) {
        super(summarize(errors));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("AssemblyException requires at least one error");
        }
        this.errors = List.copyOf(errors);
    }

    public AssemblyException(@NotNull AssemblerError error, Throwable cause) {
        super(summarize(List.of(error)), cause);
        this.errors = List.of(error);
    }

    public List<AssemblerError> getErrors() {
        return errors;
    }

    public boolean hasKind(AssemblerError.Kind kind) {
        return errors.stream().anyMatch(e -> e.kind() == kind);
    }

    private static String summarize(List<AssemblerError> errors) {
        if (errors.size() == 1) {
            return errors.get(0).toString();
        }
        return errors.size() + " errors:\n" + errors.stream()
                .map(e -> "  " + e)
                .collect(Collectors.joining("\n"));
    }
}
