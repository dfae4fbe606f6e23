package dev.braceline.transform;

/**
 * Raised when a closing brace has neither an open grouping nor an open block to close.
 */
public class StructureException extends RuntimeException {

    public static final String TOO_MANY_CLOSING_BRACKETS = "too many closing brackets";

    public StructureException() {
        super(TOO_MANY_CLOSING_BRACKETS);
    }
}
