package dev.braceline.config;

import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks {@code sh -c 'test -t 0'} about the inherited standard input. Only stdin is inspected, so a
 * redirected stdout does not change the answer.
 */
public class ShellTerminalDetector implements TerminalDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(ShellTerminalDetector.class);

    private final ProcessBuilder.Redirect input;

    public ShellTerminalDetector() {
        this(ProcessBuilder.Redirect.INHERIT);
    }

    ShellTerminalDetector(ProcessBuilder.Redirect input) {
        this.input = input;
    }

    @Override
    public boolean stdinIsTerminal() {
        ProcessBuilder builder = new ProcessBuilder(List.of("sh", "-c", "test -t 0"))
                .redirectInput(input)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        try {
            return builder.start().waitFor() == 0;
        } catch (IOException ex) {
            // no shell to ask: assume a terminal so stdin is never drained by surprise
            LOGGER.debug("Cannot inspect standard input, assuming a terminal: {}", ex.getMessage());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while inspecting standard input", ex);
        }
    }
}
