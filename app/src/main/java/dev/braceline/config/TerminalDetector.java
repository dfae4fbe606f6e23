package dev.braceline.config;

/**
 * Tells whether this process reads standard input from a terminal.
 */
@FunctionalInterface
public interface TerminalDetector {

    boolean stdinIsTerminal();
}
