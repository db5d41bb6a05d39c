package io.github.manjago.pieasm.cli;

import io.github.manjago.pieasm.core.AssemblerError;
import io.github.manjago.pieasm.core.Assembler;
import io.github.manjago.pieasm.core.AssemblyException;
import io.github.manjago.pieasm.core.Disassembler;
import io.github.manjago.pieasm.core.InstructionEncoder;
import picocli.CommandLine.Command;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: repl
 *
 * Reads one line at a time, assembles it without header or sections and
 * appends the words to an in-memory program buffer.
 *
 * Meta commands:
 *   .quit      - leave
 *   .history   - show everything typed so far
 *   .program   - list the program buffer
 *   .clear     - empty the program buffer
 */
@Command(
    name = "repl",
    description = "Assemble instructions interactively",
    mixinStandardHelpOptions = true
)
public class ReplCommand implements Callable<Integer> {

    private final InputStream in;
    private final PrintStream out;

    private final List<String> history = new ArrayList<>();
    private final ByteArrayOutputStream program = new ByteArrayOutputStream();

    public ReplCommand() {
        this(System.in, System.out);
    }

    ReplCommand(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public Integer call() throws IOException {
        Assembler assembler = new Assembler();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));

        out.println("Welcome to pieasm! Type .quit to leave.");

        while (true) {
            out.print(">>> ");
            out.flush();

            String line = reader.readLine();
            if (line == null) {
                break;
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            history.add(line);

            switch (line) {
                case ".quit" -> {
                    out.println("Farewell!");
                    return 0;
                }
                case ".history" -> history.forEach(out::println);
                case ".program" -> {
                    out.println("Listing instructions currently in the program buffer:");
                    byte[] bytes = program.toByteArray();
                    if (bytes.length > 0) {
                        out.println(Disassembler.disassemble(bytes));
                    }
                    out.println("End of Program Listing");
                }
                case ".clear" -> {
                    program.reset();
                    out.println("Program buffer cleared");
                }
                default -> assembleLine(assembler, line);
            }
        }
        return 0;
    }

    private void assembleLine(Assembler assembler, String line) {
        try {
            byte[] words = assembler.assembleSnippet(line);
            program.writeBytes(words);
            out.println("✓ " + words.length / InstructionEncoder.WORD_SIZE + " word(s), program is " + program.size() + " bytes");
        } catch (AssemblyException e) {
            for (AssemblerError error : e.getErrors()) {
                out.println("❌ " + error);
            }
        }
    }

    byte[] programBytes() {
        return program.toByteArray();
    }
}
