package dev.braceline.transform;

import dev.braceline.lex.Token;
import java.util.Set;

/**
 * Mutable state of one transducer pass. Never shared between passes.
 */
final class TransducerState {

    private final String indentUnit;
    private final StringBuilder output = new StringBuilder();
    private int indentLevel;
    private int groupingDepth;
    private int braceDepth;
    private int lineStart;
    private Token lastToken;

    TransducerState(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    int indentLevel() {
        return indentLevel;
    }

    int groupingDepth() {
        return groupingDepth;
    }

    Token lastToken() {
        return lastToken;
    }

    /**
     * Open grouping braces only; parentheses and square brackets never count here.
     */
    int braceDepth() {
        return braceDepth;
    }

    void openGrouping() {
        groupingDepth++;
    }

    void openGroupingBrace() {
        braceDepth++;
        groupingDepth++;
    }

    void closeGroupingBrace() {
        if (braceDepth > 0) {
            braceDepth--;
            closeGrouping();
        }
    }

    void closeGrouping() {
        if (groupingDepth > 0) {
            groupingDepth--;
        }
    }

    void render(Token token, Set<RenderAction> actions) {
        if (actions.contains(RenderAction.DEDENT) && indentLevel > 0) {
            indentLevel--;
        }
        if (actions.contains(RenderAction.INDENT)) {
            indentLevel++;
        }

        if (actions.contains(RenderAction.NEWLINE)) {
            if (actions.contains(RenderAction.INDENT)) {
                output.append(':');
            }
            breakLine();
        } else if (!actions.contains(RenderAction.SUPPRESS)) {
            output.append(token.text()).append(' ');
        }
        lastToken = token;
    }

    String finish() {
        int end = output.length();
        while (end > 0 && Character.isWhitespace(output.charAt(end - 1))) {
            end--;
        }
        output.setLength(end);
        return output.append('\n').toString();
    }

    /**
     * Ends the current line and starts the next one at the current indentation. A line holding only
     * indentation is reused instead of leaving a blank line behind.
     */
    private void breakLine() {
        if (currentLineIsBlank()) {
            output.setLength(lineStart);
        } else {
            trimTrailingSpaces();
            output.append('\n');
            lineStart = output.length();
        }
        output.append(indentUnit.repeat(indentLevel));
    }

    private boolean currentLineIsBlank() {
        for (int i = lineStart; i < output.length(); i++) {
            if (output.charAt(i) != ' ') {
                return false;
            }
        }
        return true;
    }

    private void trimTrailingSpaces() {
        int end = output.length();
        while (end > lineStart && output.charAt(end - 1) == ' ') {
            end--;
        }
        output.setLength(end);
    }
}
