package io.github.manjago.pieasm.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Configuration for the assembler.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record AssemblerConfig(
    // Encoding policies
    LabelPolicy unresolvedLabels,
    OffsetPolicy offsetOverflow,

    // Output
    String outputExtension
) {

    /**
     * What pass 2 does with a label reference missing from the symbol table.
     */
    public enum LabelPolicy {
        /** Record an error; no image is produced. */
        FAIL,
        /** Log the error, zero-fill the operand bytes and carry on. */
        WARN
    }

    /**
     * What the encoder does with a label offset above 0xFFFF.
     */
    public enum OffsetPolicy {
        /** Emit the low 16 bits. */
        TRUNCATE,
        /** Record an error. */
        REJECT
    }

    /**
     * Load default configuration.
     */
    public static AssemblerConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static AssemblerConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static AssemblerConfig fromConfig(Config config) {
        Config c = config.getConfig("pieasm");

        return new AssemblerConfig(
            parseEnum(LabelPolicy.class, c.getString("assembler.unresolved-labels")),
            parseEnum(OffsetPolicy.class, c.getString("assembler.offset-overflow")),
            c.getString("output.extension")
        );
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LabelPolicy unresolvedLabels = LabelPolicy.FAIL;
        private OffsetPolicy offsetOverflow = OffsetPolicy.TRUNCATE;
        private String outputExtension = ".pie";

        public Builder unresolvedLabels(LabelPolicy policy) { this.unresolvedLabels = policy; return this; }
        public Builder offsetOverflow(OffsetPolicy policy) { this.offsetOverflow = policy; return this; }
        public Builder outputExtension(String extension) { this.outputExtension = extension; return this; }

        public AssemblerConfig build() {
            return new AssemblerConfig(unresolvedLabels, offsetOverflow, outputExtension);
        }
    }

    @Override
    public String toString() {
        return String.format("""
            AssemblerConfig:
              assembler.unresolved-labels: %s
              assembler.offset-overflow:   %s
              output.extension:            %s
            """,
            unresolvedLabels,
            offsetOverflow,
            outputExtension
        );
    }
}
