package io.github.manjago.pieasm.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Fixed header of a PIE image.
 * <pre>
 * bytes 0..3   magic "-21-"
 * bytes 4..64  zero, reserved
 * bytes 65..   body (4-byte instruction words)
 * </pre>
 * Padding runs through offset {@link #PADDED_THROUGH} inclusive,
 * so the body starts at {@link #LENGTH}.
 */
public final class PieHeader {

    private static final byte[] MAGIC = {45, 50, 49, 45};

    /** Last header offset (inclusive) filled with padding. */
    public static final int PADDED_THROUGH = 64;

    /** Total header size; offset of the first body byte. */
    public static final int LENGTH = PADDED_THROUGH + 1;

    private PieHeader() {
        // Utility class
    }

    public static byte[] magic() {
        return MAGIC.clone();
    }

    /**
     * Fresh header: magic followed by zero padding.
     */
    public static byte[] write() {
        byte[] header = new byte[LENGTH];
        System.arraycopy(MAGIC, 0, header, 0, MAGIC.length);
        return header;
    }

    /**
     * Check that an image is long enough and starts with the magic prefix.
     */
    @Contract(pure = true)
    public static boolean isPie(byte @NotNull [] image) {
        return image.length >= LENGTH
                && Arrays.equals(image, 0, MAGIC.length, MAGIC, 0, MAGIC.length);
    }

    /**
     * Body of an image, without the header.
     *
     * @throws IllegalArgumentException if the image is not a PIE image
     */
    public static byte[] body(byte @NotNull [] image) {
        if (!isPie(image)) {
            throw new IllegalArgumentException("Not a PIE image (missing magic or truncated header)");
        }
        return Arrays.copyOfRange(image, LENGTH, image.length);
    }
}
