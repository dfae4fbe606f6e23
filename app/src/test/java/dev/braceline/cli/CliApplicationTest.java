package dev.braceline.cli;

import static org.assertj.core.api.Assertions.assertThat;

import dev.braceline.config.Config;
import dev.braceline.config.ConfigLoader;
import dev.braceline.exec.ScriptEngine;
import dev.braceline.exec.ScriptExecutionException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CliApplicationTest {

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    @Test
    void runsRenderedProgramWithBoundVariables() {
        RecordingScriptEngine engine = new RecordingScriptEngine(0);
        CliApplication application = application(config -> engine);

        int exitCode = application.run(new String[] {
                "-v", "who=world",
                "if who: { print(\"hello\", who) }"
        });

        assertThat(exitCode).isZero();
        assertThat(engine.programs).containsExactly("who = 'world'\nif who :\n    print ( \"hello\" , who )\n");
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void propagatesInterpreterExitCode() {
        CliApplication application = application(config -> new RecordingScriptEngine(99));

        assertThat(application.run(new String[] {"exit(99)"})).isEqualTo(99);
    }

    @Test
    void printModeWritesProgramWithoutRunningIt() {
        RecordingScriptEngine engine = new RecordingScriptEngine(0);
        CliApplication application = application(config -> engine);

        int exitCode = application.run(new String[] {"--print", "--indent-width", "2", "def s2i(s): { return int(s) }"});

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo("def s2i ( s ) :\n  return int ( s )\n");
        assertThat(engine.programs).isEmpty();
    }

    @Test
    void structureErrorIsReportedWithoutRunningInterpreter() {
        RecordingScriptEngine engine = new RecordingScriptEngine(0);
        CliApplication application = application(config -> engine);

        int exitCode = application.run(new String[] {"print(1) }"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_STRUCTURE_ERROR);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("too many closing brackets");
        assertThat(engine.programs).isEmpty();
    }

    @Test
    void interpreterFailureIsReportedSeparately() {
        CliApplication application = application(config -> program -> {
            throw new ScriptExecutionException("Failed to start interpreter 'python3'", new IOException("not found"));
        });

        int exitCode = application.run(new String[] {"pass"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_ENGINE_FAILURE);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("Failed to start interpreter");
    }

    @Test
    void invalidVariableNameIsInvalidInput() {
        CliApplication application = application(config -> new RecordingScriptEngine(0));

        int exitCode = application.run(new String[] {"--var", "not-a-name=1", "pass"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("Invalid variable name");
    }

    @Test
    void missingSourcePrintsUsage() {
        CliApplication application = application(config -> new RecordingScriptEngine(0));

        int exitCode = application.run(new String[0]);

        assertThat(exitCode).isEqualTo(2);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("SOURCE");
    }

    @Test
    void helpIsPrintedToStdout() {
        CliApplication application = application(config -> new RecordingScriptEngine(0));

        int exitCode = application.run(new String[] {"--help"});

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("Usage: braceline");
    }

    @Test
    void interpreterReceivesConfiguredCommand() {
        List<Config> seen = new ArrayList<>();
        CliApplication application = application(config -> {
            seen.add(config);
            return new RecordingScriptEngine(0);
        });

        application.run(new String[] {"--python", "python3.11", "--stdin", "interactive", "pass"});

        assertThat(seen).singleElement().satisfies(config -> {
            assertThat(config.interpreter()).isEqualTo("python3.11");
            assertThat(config.inputPiped()).isFalse();
        });
    }

    private CliApplication application(java.util.function.Function<Config, ScriptEngine> engineFactory) {
        return new CliApplication(
                new ConfigLoader(key -> Optional.empty(), () -> true),
                engineFactory,
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private static final class RecordingScriptEngine implements ScriptEngine {

        private final int exitCode;
        private final List<String> programs = new ArrayList<>();

        private RecordingScriptEngine(int exitCode) {
            this.exitCode = exitCode;
        }

        @Override
        public int execute(String program) {
            programs.add(program);
            return exitCode;
        }
    }
}
