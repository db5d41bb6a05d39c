package io.github.manjago.pieasm.cli;

import io.github.manjago.pieasm.core.Disassembler;
import io.github.manjago.pieasm.core.InstructionEncoder;
import io.github.manjago.pieasm.core.PieHeader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: disasm
 *
 * Prints the instruction listing of a PIE image.
 */
@Command(
    name = "disasm",
    description = "Disassemble a PIE image",
    mixinStandardHelpOptions = true
)
public class DisasmCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Input image file (.pie)")
    private Path inputFile;

    @Override
    public Integer call() {
        byte[] image;
        try {
            image = Files.readAllBytes(inputFile);
        } catch (IOException e) {
            System.err.println("❌ Error: " + e.getMessage());
            return 1;
        }

        if (!PieHeader.isPie(image)) {
            System.err.println("❌ Not a PIE image: " + inputFile);
            return 1;
        }

        byte[] body = PieHeader.body(image);
        if (body.length % InstructionEncoder.WORD_SIZE != 0) {
            System.err.println("❌ Corrupt image: body is " + body.length + " bytes, not whole words");
            return 1;
        }

        System.out.println("=== " + inputFile.getFileName() + " ("
                + body.length / InstructionEncoder.WORD_SIZE + " instructions) ===");
        if (body.length > 0) {
            System.out.println(Disassembler.disassemble(body));
        }
        return 0;
    }
}
