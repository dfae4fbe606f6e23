package dev.braceline.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        String source,
        Map<String, String> variables,
        boolean printOnly,
        String interpreter,
        int indentWidth,
        boolean inputPiped,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(source, "source");
        variables = variables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        interpreter = requireNonBlank(interpreter, "interpreter");
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be at least 1");
        }
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
