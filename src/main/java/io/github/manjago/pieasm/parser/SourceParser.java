package io.github.manjago.pieasm.parser;

import io.github.manjago.pieasm.core.Instruction;
import io.github.manjago.pieasm.core.OpCode;
import io.github.manjago.pieasm.core.Program;
import io.github.manjago.pieasm.core.Token;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for PIE assembly.
 *
 * <h2>Grammar:</h2>
 * <pre>
 * program     := instruction+ EOF
 * instruction := [label ':'] (opcode | '.' directive) operand{0,3}
 * operand     := '#' ['-'|'+'] digits     ; integer
 *              | '@' identifier           ; label reference
 *              | '$' digits               ; register
 *              | '\'' chars '\''          ; string, no escapes
 * </pre>
 * Whitespace (including newlines) and {@code ;} comments may appear between any two tokens.
 * Unknown mnemonics parse as {@link OpCode#IGL}. Input that is not consumed completely
 * fails the whole program.
 */
public final class SourceParser {

    private final SourceReader reader;

    private SourceParser(String source) {
        this.reader = new SourceReader(source);
    }

    /**
     * Parse a complete source buffer.
     *
     * @throws ParseException if the text is empty or not fully consumed
     */
    public static @NotNull Program parseProgram(@NotNull String source) throws ParseException {
        return new SourceParser(source).program();
    }

    /**
     * Parse exactly one instruction; trailing trivia is allowed, anything else is not.
     */
    public static @NotNull Instruction parseInstruction(@NotNull String source) throws ParseException {
        SourceParser parser = new SourceParser(source);
        parser.reader.skipTrivia();
        Instruction instruction = parser.instruction();
        parser.reader.skipTrivia();
        if (!parser.reader.atEnd()) {
            throw parser.error("Unexpected input after instruction: '" + parser.reader.peek() + "'");
        }
        return instruction;
    }

    private Program program() throws ParseException {
        List<Instruction> instructions = new ArrayList<>();
        reader.skipTrivia();
        if (reader.atEnd()) {
            throw error("Expected at least one instruction");
        }
        while (!reader.atEnd()) {
            instructions.add(instruction());
            reader.skipTrivia();
        }
        return new Program(instructions);
    }

    private Instruction instruction() throws ParseException {
        int line = reader.line();
        Token.LabelDeclaration label = labelDeclaration();
        if (label != null) {
            reader.skipTrivia();
        }

        Token.Op opcode = null;
        Token.Directive directive = null;
        if (reader.accept('.')) {
            String name = reader.letters();
            if (name.isEmpty()) {
                throw error("Expected directive name after '.'");
            }
            directive = new Token.Directive(name);
        } else if (SourceReader.isAsciiLetter(reader.peek())) {
            opcode = new Token.Op(OpCode.fromMnemonic(reader.letters()));
        } else {
            throw error(reader.atEnd()
                    ? "Expected opcode or directive, found end of input"
                    : "Expected opcode or directive, found '" + reader.peek() + "'");
        }

        List<Token> operands = new ArrayList<>(Instruction.MAX_OPERANDS);
        while (operands.size() < Instruction.MAX_OPERANDS) {
            Token operand = operand();
            if (operand == null) {
                break;
            }
            operands.add(operand);
        }

        return new Instruction(label, opcode, directive, operands, line);
    }

    /**
     * {@code identifier ':'}; rewinds and returns null if the colon is missing.
     */
    private Token.@Nullable LabelDeclaration labelDeclaration() {
        SourceReader.Mark start = reader.mark();
        String name = reader.identifier();
        if (!name.isEmpty() && reader.accept(':')) {
            return new Token.LabelDeclaration(name);
        }
        reader.reset(start);
        return null;
    }

    /**
     * Next operand, or null (with the cursor restored) if none starts here.
     * Alternatives are tried in order: integer, label reference, register, string.
     */
    private @Nullable Token operand() throws ParseException {
        SourceReader.Mark start = reader.mark();
        reader.skipTrivia();
        return switch (reader.peek()) {
            case '#' -> integerOperand();
            case '@' -> labelUsage();
            case '$' -> register();
            case '\'' -> stringLiteral();
            default -> {
                reader.reset(start);
                yield null;
            }
        };
    }

    private Token integerOperand() throws ParseException {
        reader.next();
        StringBuilder literal = new StringBuilder();
        if (reader.peek() == '-' || reader.peek() == '+') {
            literal.append(reader.next());
        }
        String digits = reader.digits();
        if (digits.isEmpty()) {
            throw error("Expected digits after '#'");
        }
        literal.append(digits);
        try {
            return new Token.IntegerOperand(Integer.parseInt(literal.toString()));
        } catch (NumberFormatException e) {
            throw new ParseException("Integer literal too large: #" + literal, reader.line(), reader.column(), e);
        }
    }

    private Token labelUsage() throws ParseException {
        reader.next();
        String name = reader.identifier();
        if (name.isEmpty()) {
            throw error("Expected label name after '@'");
        }
        return new Token.LabelUsage(name);
    }

    private Token register() throws ParseException {
        reader.next();
        String digits = reader.digits();
        if (digits.isEmpty()) {
            throw error("Expected register number after '$'");
        }
        // Register indices are single bytes
        if (digits.length() > 3 || Integer.parseInt(digits) > 0xFF) {
            throw error("Register out of range: $" + digits + " (expected $0-$255)");
        }
        return new Token.Register(Integer.parseInt(digits));
    }

    private Token stringLiteral() throws ParseException {
        int line = reader.line();
        int column = reader.column();
        reader.next();
        String content = reader.until('\'');
        if (content == null) {
            throw new ParseException("Unterminated string literal", line, column);
        }
        reader.next();
        return new Token.StringLiteral(content);
    }

    private ParseException error(String message) {
        return new ParseException(message, reader.line(), reader.column());
    }
}
