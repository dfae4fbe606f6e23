package dev.braceline.config;

import dev.braceline.cli.CliArguments;
import java.util.Objects;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_PRINT = "BRACELINE_PRINT";
    static final String ENV_PYTHON = "BRACELINE_PYTHON";
    static final String ENV_INDENT_WIDTH = "BRACELINE_INDENT_WIDTH";
    static final String ENV_STDIN = "BRACELINE_STDIN";
    static final String ENV_LOG_FORMAT = "BRACELINE_LOG_FORMAT";
    static final String ENV_VERBOSE = "BRACELINE_VERBOSE";

    private static final String DEFAULT_INTERPRETER = "python3";
    private static final int DEFAULT_INDENT_WIDTH = 4;

    private final EnvironmentReader environmentReader;
    private final TerminalDetector terminalDetector;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, new ShellTerminalDetector());
    }

    public ConfigLoader(EnvironmentReader environmentReader, TerminalDetector terminalDetector) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.terminalDetector = Objects.requireNonNull(terminalDetector, "terminalDetector");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.source() == null) {
            throw new IllegalArgumentException("source code must be provided");
        }

        boolean printOnly = resolveFlag(arguments.printOnly(), ENV_PRINT);
        boolean verbose = resolveFlag(arguments.verbose(), ENV_VERBOSE);
        String interpreter = firstNonBlank(arguments.interpreter(), ENV_PYTHON, DEFAULT_INTERPRETER);
        int indentWidth = resolveIndentWidth(arguments);
        StdinMode stdinMode = resolveStdinMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        boolean inputPiped = !printOnly && stdinMode.isPiped(terminalDetector);

        return new Config(arguments.source(), arguments.variables(), printOnly, interpreter, indentWidth,
                inputPiped, logFormat, verbose);
    }

    private boolean resolveFlag(boolean cliValue, String envKey) {
        if (cliValue) {
            return true;
        }
        return environmentReader.get(envKey)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private int resolveIndentWidth(CliArguments arguments) {
        Integer cliWidth = arguments.indentWidth();
        if (cliWidth != null) {
            if (cliWidth < 1) {
                throw new IllegalArgumentException("--indent-width must be at least 1");
            }
            return cliWidth;
        }
        return environmentReader.get(ENV_INDENT_WIDTH)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseIndentWidth)
                .orElse(DEFAULT_INDENT_WIDTH);
    }

    private StdinMode resolveStdinMode(CliArguments arguments) {
        StdinMode cliMode = arguments.stdinMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_STDIN)
                .map(StdinMode::from)
                .orElse(StdinMode.AUTO);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static int parseIndentWidth(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_INDENT_WIDTH + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_INDENT_WIDTH + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
