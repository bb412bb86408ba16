// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.conduit.core;

/**
 * ANSI color palette for debug output with automatic TTY detection.
 *
 * <p>
 * Colors are disabled when not running in a TTY environment unless
 * {@code FORCE_COLOR=true} is set, in which case every constant is the empty
 * string and can be concatenated freely.
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** ANSI reset code. */
    public static final String RESET = ansi("0");

    /** Success indicators. */
    public static final String TEAL = ansi("38;5;44");

    /** Error indicators. */
    public static final String CORAL = ansi("38;5;204");

    /** Informational messages. */
    public static final String INDIGO = ansi("38;5;99");

    /** Warnings and connection state changes. */
    public static final String AMBER = ansi("38;5;214");

    /** Subscription traffic. */
    public static final String LAVENDER = ansi("38;5;183");

    /** Metadata and secondary information. */
    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }

    /**
     * Formats a duration in microseconds as a human-readable string.
     *
     * @param micros duration in microseconds
     * @return formatted duration (e.g., "1.5ms" or "2.3s")
     */
    public static String duration(final long micros) {
        if (micros < 1000)
            return micros + "μs";
        if (micros < 1_000_000)
            return String.format("%.1fms", micros / 1000.0);
        return String.format("%.2fs", micros / 1_000_000.0);
    }
}
