package dev.braceline.lex;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Scanner for the Python surface grammar. Indentation is not tracked: leading whitespace is dropped
 * and every physical line break becomes a {@link TokenKind#NEWLINE} token.
 */
public class PythonLexer implements Lexer {

    private static final String ENCODING = "utf-8";
    private static final List<String> THREE_CHAR_OPERATORS = List.of("**=", "//=", ">>=", "<<=", "...");
    private static final List<String> TWO_CHAR_OPERATORS = List.of(
            "**", "//", "<<", ">>", "<=", ">=", "==", "!=", "->", ":=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=");
    private static final String SINGLE_CHAR_OPERATORS = "+-*/%@&|^~<>=.,;:()[]{}";
    private static final Set<String> STRING_PREFIXES = Set.of("r", "u", "f", "b", "br", "rb", "fr", "rf");

    @Override
    public TokenStream tokenize(String source) {
        return new Scanner(Objects.requireNonNull(source, "source"));
    }

    private static final class Scanner extends TokenStream {

        private final String source;
        private int position;
        private boolean started;
        private boolean finished;

        private Scanner(String source) {
            this.source = source;
        }

        @Override
        protected Token scan() {
            if (!started) {
                started = true;
                return new Token(TokenKind.ENCODING, ENCODING);
            }
            if (finished) {
                return null;
            }
            skipWhitespace();
            if (position >= source.length()) {
                finished = true;
                return new Token(TokenKind.END_OF_STREAM, "");
            }

            char ch = source.charAt(position);
            if (ch == '\r' || ch == '\n') {
                position += lineBreakLength(position);
                return new Token(TokenKind.NEWLINE, "\n");
            }
            if (ch == '#') {
                return scanComment();
            }
            int prefixLength = stringPrefixLength();
            if (prefixLength >= 0) {
                return scanString(prefixLength);
            }
            int codePoint = source.codePointAt(position);
            if (codePoint == '_' || Character.isUnicodeIdentifierStart(codePoint)) {
                return scanName();
            }
            if (Character.isDigit(ch) || (ch == '.' && isDigitAt(position + 1))) {
                return scanNumber();
            }
            return scanOperator();
        }

        private void skipWhitespace() {
            while (position < source.length()) {
                char ch = source.charAt(position);
                if (ch == ' ' || ch == '\t' || ch == '\f') {
                    position++;
                } else if (ch == '\\' && position + 1 < source.length() && isLineBreak(source.charAt(position + 1))) {
                    position += 1 + lineBreakLength(position + 1);
                } else {
                    return;
                }
            }
        }

        private Token scanComment() {
            int start = position;
            while (position < source.length() && !isLineBreak(source.charAt(position))) {
                position++;
            }
            return new Token(TokenKind.COMMENT, source.substring(start, position));
        }

        /**
         * Length of the string prefix at the current position, {@code 0} for a bare quote, or {@code -1}
         * when no string literal starts here.
         */
        private int stringPrefixLength() {
            for (int length = 0; length <= 2 && position + length < source.length(); length++) {
                char candidate = source.charAt(position + length);
                if (candidate == '\'' || candidate == '"') {
                    String prefix = source.substring(position, position + length).toLowerCase(Locale.ROOT);
                    return length == 0 || STRING_PREFIXES.contains(prefix) ? length : -1;
                }
                if (!Character.isLetter(candidate)) {
                    return -1;
                }
            }
            return -1;
        }

        private Token scanString(int prefixLength) {
            int start = position;
            position += prefixLength;
            char quote = source.charAt(position);
            boolean triple = source.startsWith(String.valueOf(quote).repeat(3), position);
            int quoteLength = triple ? 3 : 1;
            position += quoteLength;

            while (position < source.length()) {
                char ch = source.charAt(position);
                if (ch == '\\') {
                    position = Math.min(position + 2, source.length());
                    continue;
                }
                if (!triple && isLineBreak(ch)) {
                    // unterminated single-line literal: hand the fragment over as is
                    return new Token(TokenKind.STRING, source.substring(start, position));
                }
                if (ch == quote && (!triple || source.startsWith(String.valueOf(quote).repeat(3), position))) {
                    position += quoteLength;
                    return new Token(TokenKind.STRING, source.substring(start, position));
                }
                position++;
            }
            // end of input inside the literal ends the stream
            return new Token(TokenKind.STRING, source.substring(start));
        }

        private Token scanName() {
            int start = position;
            position += Character.charCount(source.codePointAt(position));
            while (position < source.length()) {
                int codePoint = source.codePointAt(position);
                if (codePoint != '_' && !Character.isUnicodeIdentifierPart(codePoint)) {
                    break;
                }
                position += Character.charCount(codePoint);
            }
            return new Token(TokenKind.NAME, source.substring(start, position));
        }

        private Token scanNumber() {
            int start = position;
            if (source.charAt(position) == '0' && position + 1 < source.length()
                    && "xXoObB".indexOf(source.charAt(position + 1)) >= 0) {
                position += 2;
                while (position < source.length()
                        && (Character.digit(source.charAt(position), 16) >= 0 || source.charAt(position) == '_')) {
                    position++;
                }
                return new Token(TokenKind.NUMBER, source.substring(start, position));
            }

            consumeDigits();
            if (position < source.length() && source.charAt(position) == '.') {
                position++;
                consumeDigits();
            }
            if (position < source.length() && (source.charAt(position) == 'e' || source.charAt(position) == 'E')) {
                int exponentStart = position;
                position++;
                if (position < source.length() && (source.charAt(position) == '+' || source.charAt(position) == '-')) {
                    position++;
                }
                if (isDigitAt(position)) {
                    consumeDigits();
                } else {
                    position = exponentStart;
                }
            }
            if (position < source.length() && (source.charAt(position) == 'j' || source.charAt(position) == 'J')) {
                position++;
            }
            return new Token(TokenKind.NUMBER, source.substring(start, position));
        }

        private void consumeDigits() {
            while (position < source.length()
                    && (Character.isDigit(source.charAt(position)) || source.charAt(position) == '_')) {
                position++;
            }
        }

        private Token scanOperator() {
            for (String operator : THREE_CHAR_OPERATORS) {
                if (source.startsWith(operator, position)) {
                    position += 3;
                    return new Token(TokenKind.OPERATOR, operator);
                }
            }
            for (String operator : TWO_CHAR_OPERATORS) {
                if (source.startsWith(operator, position)) {
                    position += 2;
                    return new Token(TokenKind.OPERATOR, operator);
                }
            }
            char ch = source.charAt(position);
            if (SINGLE_CHAR_OPERATORS.indexOf(ch) >= 0) {
                position++;
                return new Token(classifyPunctuation(ch), String.valueOf(ch));
            }
            int codePoint = source.codePointAt(position);
            position += Character.charCount(codePoint);
            return new Token(TokenKind.ERROR, new String(Character.toChars(codePoint)));
        }

        private boolean isDigitAt(int index) {
            return index < source.length() && Character.isDigit(source.charAt(index));
        }

        private int lineBreakLength(int index) {
            if (source.charAt(index) == '\r' && index + 1 < source.length() && source.charAt(index + 1) == '\n') {
                return 2;
            }
            return 1;
        }
    }

    private static TokenKind classifyPunctuation(char ch) {
        return switch (ch) {
            case ';' -> TokenKind.SEMICOLON;
            case ':' -> TokenKind.COLON;
            case '{' -> TokenKind.LEFT_BRACE;
            case '}' -> TokenKind.RIGHT_BRACE;
            case '(', '[' -> TokenKind.OPEN_BRACKET;
            case ')', ']' -> TokenKind.CLOSE_BRACKET;
            default -> TokenKind.OPERATOR;
        };
    }

    private static boolean isLineBreak(char ch) {
        return ch == '\n' || ch == '\r';
    }
}
