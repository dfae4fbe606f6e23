package dev.braceline.lex;

import java.util.Objects;

/**
 * Atomic lexical unit; {@code text} is the exact source substring.
 */
public record Token(TokenKind kind, String text) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public boolean is(TokenKind candidate) {
        return kind == candidate;
    }

    @Override
    public String toString() {
        return kind + " '" + text + "'";
    }
}
