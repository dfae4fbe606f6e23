package dev.braceline.lex;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, single-use sequence of tokens. Subclasses scan one token per {@link #scan()} call.
 */
public abstract class TokenStream implements Iterator<Token> {

    private Token lookahead;
    private boolean exhausted;

    /**
     * Scans the next token, or returns {@code null} once the stream is finished.
     */
    protected abstract Token scan();

    @Override
    public boolean hasNext() {
        if (lookahead == null && !exhausted) {
            lookahead = scan();
            exhausted = lookahead == null;
        }
        return lookahead != null;
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Token stream exhausted");
        }
        Token token = lookahead;
        lookahead = null;
        return token;
    }

    /**
     * Consumes the remaining tokens into a list.
     */
    public List<Token> drain() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }
}
