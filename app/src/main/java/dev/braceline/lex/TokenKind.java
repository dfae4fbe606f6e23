package dev.braceline.lex;

/**
 * Classification of lexical units produced by a {@link Lexer}.
 */
public enum TokenKind {
    ENCODING,
    NAME,
    NUMBER,
    STRING,
    OPERATOR,
    SEMICOLON,
    COLON,
    LEFT_BRACE,
    RIGHT_BRACE,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    COMMENT,
    NEWLINE,
    ERROR,
    END_OF_STREAM;

    /**
     * Structural tokens mark stream boundaries and never carry source text worth rendering.
     */
    public boolean isStructural() {
        return this == ENCODING || this == END_OF_STREAM;
    }
}
