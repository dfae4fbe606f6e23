package dev.braceline.transform;

/**
 * One-shot rendering actions computed for a single token and consumed before the next one.
 */
enum RenderAction {
    NEWLINE,
    INDENT,
    DEDENT,
    SUPPRESS
}
