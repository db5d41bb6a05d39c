package io.github.manjago.pieasm.cli;

import io.github.manjago.pieasm.config.AssemblerConfig;
import io.github.manjago.pieasm.core.AssemblerError;
import io.github.manjago.pieasm.core.Assembler;
import io.github.manjago.pieasm.core.AssemblyException;
import io.github.manjago.pieasm.core.AssemblyOutput;
import io.github.manjago.pieasm.core.Disassembler;
import io.github.manjago.pieasm.core.Symbol;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: assemble
 *
 * Assembles text assembly source into a PIE image.
 *
 * Usage:
 *   pieasm assemble input.asm -o output.pie
 *   pieasm assemble input.asm --disasm  (show disassembly)
 */
@Command(
    name = "assemble",
    description = "Assemble text source to a PIE image",
    mixinStandardHelpOptions = true
)
public class AssembleCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Input assembly file (.asm)")
    private Path inputFile;

    @Option(names = {"-o", "--output"}, description = "Output image file (.pie)")
    private Path outputFile;

    @Option(names = {"-d", "--disasm"}, description = "Show disassembly after assembly")
    private boolean showDisassembly;

    @Option(names = {"-c", "--config"}, description = "HOCON configuration file")
    private Path configFile;

    @Option(names = {"-v", "--verbose"}, description = "Verbose output")
    private boolean verbose;

    @Override
    public Integer call() {
        try {
            System.out.println("Assembling: " + inputFile);

            AssemblerConfig config = configFile != null
                    ? AssemblerConfig.fromFile(configFile)
                    : AssemblerConfig.defaults();

            Assembler assembler = new Assembler(config);
            String source = Files.readString(inputFile, StandardCharsets.UTF_8);
            AssemblyOutput output = assembler.assembleDetailed(source);

            System.out.println("✓ Assembled " + output.instructionCount() + " instructions ("
                    + output.image().length + " bytes)");

            if (verbose) {
                System.out.println();
                System.out.println("=== Symbols ===");
                for (Symbol symbol : output.symbols().symbols()) {
                    System.out.printf("%-16s %08X%n", symbol.name(), symbol.offset());
                }
                System.out.println("Read-only segment: " + output.readOnlyData().length + " bytes");
            }

            // Show disassembly if requested
            if (showDisassembly || verbose) {
                System.out.println();
                System.out.println("=== Disassembly ===");
                System.out.println(Disassembler.disassemble(output.body()));
                System.out.println();
            }

            Path target = outputFile != null ? outputFile : defaultOutput(config);
            Files.write(target, output.image());
            System.out.println("✓ Written to: " + target);

            return 0;

        } catch (AssemblyException e) {
            System.err.println("❌ Assembly failed with " + e.getErrors().size() + " error(s):");
            for (AssemblerError error : e.getErrors()) {
                System.err.println("  " + error);
            }
            return 1;
        } catch (IOException e) {
            System.err.println("❌ Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    /**
     * Same name as the input with the configured image extension.
     */
    private Path defaultOutput(AssemblerConfig config) {
        String name = inputFile.getFileName().toString();
        if (name.endsWith(".asm")) {
            name = name.substring(0, name.length() - 4);
        }
        return inputFile.resolveSibling(name + config.outputExtension());
    }
}
