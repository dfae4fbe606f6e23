package dev.braceline.lex;

/**
 * Turns source text into an ordered stream of tokens.
 */
public interface Lexer {

    /**
     * Returns a lazy stream that starts with an {@link TokenKind#ENCODING} token and ends with
     * {@link TokenKind#END_OF_STREAM}. The stream can be consumed once.
     */
    TokenStream tokenize(String source);
}
