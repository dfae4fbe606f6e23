package dev.braceline.cli;

import dev.braceline.config.LogFormat;
import dev.braceline.config.StdinMode;
import java.util.Map;
import picocli.CommandLine;

@CommandLine.Command(name = "braceline", mixinStandardHelpOptions = true, version = "braceline 1.0.0",
        description = "Runs brace-delimited, semicolon-separated Python written on a single line")
public class CliArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "SOURCE", description = "Program text, e.g. 'for i in range(3): { print(i) }'")
    private String source;

    @CommandLine.Option(names = {"-v", "--var"}, paramLabel = "NAME=VALUE", description = "Bind a string variable before the program runs (repeatable)")
    private Map<String, String> variables;

    @CommandLine.Option(names = {"-p", "--print"}, description = "Print the indented program instead of running it")
    private boolean printOnly;

    @CommandLine.Option(names = "--python", description = "Interpreter command (default: python3)", paramLabel = "COMMAND")
    private String interpreter;

    @CommandLine.Option(names = "--indent-width", description = "Spaces per indentation level (default: 4)", paramLabel = "COUNT")
    private Integer indentWidth;

    @CommandLine.Option(names = "--stdin", description = "Standard input handling: auto, piped or interactive", converter = StdinModeConverter.class)
    private StdinMode stdinMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--verbose", description = "Log debug details to stderr")
    private boolean verbose;

    public String source() {
        return source;
    }

    public Map<String, String> variables() {
        return variables == null ? Map.of() : variables;
    }

    public boolean printOnly() {
        return printOnly;
    }

    public String interpreter() {
        return interpreter;
    }

    public Integer indentWidth() {
        return indentWidth;
    }

    public StdinMode stdinMode() {
        return stdinMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
