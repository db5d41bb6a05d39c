package io.github.manjago.pieasm.cli;

import io.github.manjago.pieasm.config.AssemblerConfig;
import io.github.manjago.pieasm.core.OpCode;
import io.github.manjago.pieasm.core.PieHeader;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about pieasm.
 */
@Command(
    name = "info",
    description = "Show version, configuration and opcode table",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║               PIEASM                  ║");
        System.out.println("║       PIE bytecode assembler          ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(AssemblerConfig.defaults());

        System.out.println("Image header: " + PieHeader.LENGTH + " bytes");
        System.out.println();
        System.out.println("Opcodes:");
        for (OpCode op : OpCode.values()) {
            System.out.printf("  %3d  %-5s %s%n", op.getCode(), op.getMnemonic(), op.getShape());
        }

        return 0;
    }
}
