package io.github.manjago.pieasm.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * pieasm CLI - assembler for the PIE register machine.
 *
 * Usage:
 *   pieasm assemble <file>     - Assemble source to a PIE image
 *   pieasm disasm <file.pie>   - List the instructions of an image
 *   pieasm repl                - Assemble lines interactively
 *   pieasm info                - Show version, config and opcode table
 */
@Command(
    name = "pieasm",
    description = "Two-pass assembler producing PIE bytecode images",
    mixinStandardHelpOptions = true,
    version = "pieasm 1.0.0",
    subcommands = {
        AssembleCommand.class,
        DisasmCommand.class,
        ReplCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class PieAsmCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static CommandLine commandLine() {
        return new CommandLine(new PieAsmCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
