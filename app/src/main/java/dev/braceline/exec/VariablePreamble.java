package dev.braceline.exec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Binds named string values in the program namespace by prepending Python assignments.
 */
public final class VariablePreamble {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    private final Map<String, String> variables;

    public VariablePreamble(Map<String, String> variables) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (variables != null) {
            variables.forEach((name, value) -> copy.put(requireIdentifier(name), value == null ? "" : value));
        }
        this.variables = copy;
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    public String render() {
        StringBuilder builder = new StringBuilder();
        variables.forEach((name, value) -> builder.append(name).append(" = ").append(quote(value)).append('\n'));
        return builder.toString();
    }

    public String prependTo(String program) {
        return render() + program;
    }

    private static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches() || KEYWORDS.contains(name)) {
            throw new IllegalArgumentException("Invalid variable name: " + name);
        }
        return name;
    }

    static String quote(String value) {
        StringBuilder escaped = new StringBuilder(value.length() + 8);
        escaped.append('\'');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> escaped.append("\\\\");
                case '\'' -> escaped.append("\\'");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (ch < 0x20 || ch == 0x7f) {
                        escaped.append(String.format("\\x%02x", (int) ch));
                    } else {
                        escaped.append(ch);
                    }
                }
            }
        }
        escaped.append('\'');
        return escaped.toString();
    }
}
