package dev.braceline.config;

/**
 * How standard input reaches the interpreter.
 */
public enum StdinMode {
    AUTO,
    PIPED,
    INTERACTIVE;

    public static StdinMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO;
        }
        for (StdinMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported stdin mode: " + raw);
    }

    /**
     * Decides whether input is piped; only {@link #AUTO} consults the detector and treats a
     * non-terminal stdin as a pipe.
     */
    public boolean isPiped(TerminalDetector detector) {
        return switch (this) {
            case PIPED -> true;
            case INTERACTIVE -> false;
            case AUTO -> !detector.stdinIsTerminal();
        };
    }
}
