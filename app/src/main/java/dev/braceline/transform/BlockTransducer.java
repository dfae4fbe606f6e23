package dev.braceline.transform;

import dev.braceline.lex.Lexer;
import dev.braceline.lex.PythonLexer;
import dev.braceline.lex.Token;
import dev.braceline.lex.TokenKind;
import dev.braceline.lex.TokenStream;
import java.util.EnumSet;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites brace-delimited, semicolon-separated Python into indentation-based Python.
 *
 * <p>A colon outside any grouping ends a compound statement header and opens an indented block; a
 * brace directly after such a colon is the block opener and disappears from the output, as does the
 * brace that closes the block. Every other brace is a literal and is kept. Parentheses and square
 * brackets count as grouping for colons too, so slices and annotations keep their colons, but only
 * literal braces can absorb a closing brace.</p>
 *
 * <p>The output is not meant to be fed back in: it uses indentation, not braces, so transforming it
 * again yields a different program.</p>
 */
public class BlockTransducer implements SourceTransformer {

    public static final int DEFAULT_INDENT_WIDTH = 4;

    private static final Logger LOGGER = LoggerFactory.getLogger(BlockTransducer.class);

    private final Lexer lexer;
    private final String indentUnit;

    public BlockTransducer() {
        this(new PythonLexer(), DEFAULT_INDENT_WIDTH);
    }

    public BlockTransducer(Lexer lexer, int indentWidth) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be at least 1");
        }
        this.indentUnit = " ".repeat(indentWidth);
    }

    @Override
    public String transform(String source) {
        Objects.requireNonNull(source, "source");
        TransducerState state = new TransducerState(indentUnit);
        TokenStream tokens = lexer.tokenize(source);
        int count = 0;
        while (tokens.hasNext()) {
            Token token = tokens.next();
            if (token.kind().isStructural()) {
                continue;
            }
            state.render(token, classify(token, state));
            count++;
        }
        String rendered = state.finish();
        LOGGER.debug("Transformed {} tokens into {} characters (open blocks at end: {})",
                count, rendered.length(), state.indentLevel());
        return rendered;
    }

    private EnumSet<RenderAction> classify(Token token, TransducerState state) {
        return switch (token.kind()) {
            case SEMICOLON -> EnumSet.of(RenderAction.NEWLINE);
            case NEWLINE -> classifyLineBreak(state);
            case COLON -> state.groupingDepth() == 0
                    ? EnumSet.of(RenderAction.NEWLINE, RenderAction.INDENT)
                    : EnumSet.noneOf(RenderAction.class);
            case LEFT_BRACE -> classifyOpeningBrace(state);
            case RIGHT_BRACE -> classifyClosingBrace(state);
            case OPEN_BRACKET -> {
                state.openGrouping();
                yield EnumSet.noneOf(RenderAction.class);
            }
            case CLOSE_BRACKET -> {
                state.closeGrouping();
                yield EnumSet.noneOf(RenderAction.class);
            }
            default -> EnumSet.noneOf(RenderAction.class);
        };
    }

    private EnumSet<RenderAction> classifyLineBreak(TransducerState state) {
        if (state.groupingDepth() == 0 || isComment(state.lastToken())) {
            return EnumSet.of(RenderAction.NEWLINE);
        }
        // implicit line joining inside brackets
        return EnumSet.of(RenderAction.SUPPRESS);
    }

    private EnumSet<RenderAction> classifyOpeningBrace(TransducerState state) {
        if (isHeaderColon(state.lastToken(), state)) {
            return EnumSet.of(RenderAction.SUPPRESS);
        }
        state.openGroupingBrace();
        return EnumSet.noneOf(RenderAction.class);
    }

    private EnumSet<RenderAction> classifyClosingBrace(TransducerState state) {
        if (state.braceDepth() > 0) {
            state.closeGroupingBrace();
            return EnumSet.noneOf(RenderAction.class);
        }
        if (state.indentLevel() > 0) {
            return EnumSet.of(RenderAction.NEWLINE, RenderAction.DEDENT, RenderAction.SUPPRESS);
        }
        throw new StructureException();
    }

    /**
     * A block opener follows a colon seen outside any grouping; the block opener leaves the depth
     * untouched, so the current depth is the depth the colon was seen at.
     */
    private static boolean isHeaderColon(Token lastToken, TransducerState state) {
        return lastToken != null && lastToken.is(TokenKind.COLON) && state.groupingDepth() == 0;
    }

    private static boolean isComment(Token token) {
        return token != null && token.is(TokenKind.COMMENT);
    }
}
