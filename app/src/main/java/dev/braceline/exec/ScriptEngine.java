package dev.braceline.exec;

/**
 * Runs a rendered program and reports its exit status.
 */
@FunctionalInterface
public interface ScriptEngine {

    /**
     * @throws ScriptExecutionException when the program could not be run at all
     */
    int execute(String program);
}
