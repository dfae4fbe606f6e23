package dev.braceline.exec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a program with an external interpreter ({@code <interpreter> -c <program>}) sharing this
 * process's stdout and stderr.
 */
public class PythonProcessEngine implements ScriptEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(PythonProcessEngine.class);

    private final String interpreter;
    private final boolean inputPiped;
    private final InputStream stdin;

    public PythonProcessEngine(String interpreter, boolean inputPiped) {
        this(interpreter, inputPiped, System.in);
    }

    PythonProcessEngine(String interpreter, boolean inputPiped, InputStream stdin) {
        this.interpreter = requireNonBlank(interpreter);
        this.inputPiped = inputPiped;
        this.stdin = Objects.requireNonNull(stdin, "stdin");
    }

    @Override
    public int execute(String program) {
        Objects.requireNonNull(program, "program");
        byte[] input = inputPiped ? drainInput() : null;
        ProcessBuilder builder = new ProcessBuilder(List.of(interpreter, "-c", program))
                .redirectOutput(ProcessBuilder.Redirect.INHERIT)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .redirectInput(inputPiped ? ProcessBuilder.Redirect.PIPE : ProcessBuilder.Redirect.INHERIT);

        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new ScriptExecutionException("Failed to start interpreter '" + interpreter + "'", ex);
        }
        LOGGER.debug("Started {} (pid {}, piped input: {})", interpreter, process.pid(), inputPiped);

        if (input != null) {
            feed(process, input);
        }
        try {
            int exitCode = process.waitFor();
            LOGGER.debug("Interpreter exited with code {}", exitCode);
            return exitCode;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new ScriptExecutionException("Interrupted while waiting for interpreter", ex);
        }
    }

    private byte[] drainInput() {
        try {
            return stdin.readAllBytes();
        } catch (IOException ex) {
            throw new ScriptExecutionException("Failed to read standard input", ex);
        }
    }

    private void feed(Process process, byte[] input) {
        try (OutputStream target = process.getOutputStream()) {
            target.write(input);
        } catch (IOException ex) {
            if (!isBrokenPipe(ex)) {
                throw new ScriptExecutionException("Failed to pipe standard input to interpreter", ex);
            }
            LOGGER.debug("Interpreter stopped reading its input: {}", ex.getMessage());
        }
    }

    private static boolean isBrokenPipe(IOException ex) {
        String message = ex.getMessage();
        return message != null && (message.contains("Broken pipe") || message.contains("Stream closed"));
    }

    private static String requireNonBlank(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("interpreter must not be blank");
        }
        return value;
    }
}
