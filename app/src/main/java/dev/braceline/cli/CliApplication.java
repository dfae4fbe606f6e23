package dev.braceline.cli;

import dev.braceline.config.Config;
import dev.braceline.config.ConfigLoader;
import dev.braceline.config.SystemEnvironmentReader;
import dev.braceline.exec.PythonProcessEngine;
import dev.braceline.exec.ScriptEngine;
import dev.braceline.exec.ScriptExecutionException;
import dev.braceline.exec.VariablePreamble;
import dev.braceline.lex.PythonLexer;
import dev.braceline.logging.LoggingConfigurator;
import dev.braceline.transform.BlockTransducer;
import dev.braceline.transform.SourceTransformer;
import dev.braceline.transform.StructureException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, the block transducer and the interpreter.
 */
public final class CliApplication {

    static final int EXIT_STRUCTURE_ERROR = 1;
    static final int EXIT_ENGINE_FAILURE = 127;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final String PROGRAM = "braceline";

    private final ConfigLoader configLoader;
    private final Function<Config, ScriptEngine> engineFactory;
    private final PrintStream out;
    private final PrintStream err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createEngine, System.out, System.err);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, ScriptEngine> engineFactory, PrintStream out, PrintStream err) {
        this.configLoader = configLoader;
        this.engineFactory = engineFactory;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments)
                .setOut(new PrintWriter(out, true))
                .setErr(new PrintWriter(err, true));

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        VariablePreamble preamble;
        try {
            config = configLoader.load(cliArguments);
            preamble = new VariablePreamble(config.variables());
        } catch (IllegalArgumentException ex) {
            err.println(PROGRAM + ": " + ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.debug("Transforming {} characters (indentWidth={}, printOnly={}, inputPiped={})",
                config.source().length(), config.indentWidth(), config.printOnly(), config.inputPiped());

        SourceTransformer transformer = new BlockTransducer(new PythonLexer(), config.indentWidth());
        String rendered;
        try {
            rendered = transformer.transform(config.source());
        } catch (StructureException ex) {
            err.println(PROGRAM + ": " + ex.getMessage());
            return EXIT_STRUCTURE_ERROR;
        }

        if (!preamble.isEmpty()) {
            LOGGER.debug("Binding variables {}", config.variables().keySet());
        }
        String program = preamble.prependTo(rendered);
        LOGGER.debug("Rendered program:\n{}", program);
        if (config.printOnly()) {
            out.print(program);
            out.flush();
            return 0;
        }

        try {
            return engineFactory.apply(config).execute(program);
        } catch (ScriptExecutionException ex) {
            LOGGER.debug("Interpreter failure", ex);
            err.println(PROGRAM + ": " + ex.getMessage());
            return EXIT_ENGINE_FAILURE;
        }
    }

    private static ScriptEngine createEngine(Config config) {
        return new PythonProcessEngine(config.interpreter(), config.inputPiped());
    }
}
